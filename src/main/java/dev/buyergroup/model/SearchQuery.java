package dev.buyergroup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One planned provider search: company filter plus optional title and department filters.
 */
@Value
@Builder
public class SearchQuery {

    public enum Kind {
        BROAD,
        ROLE,
        DEPARTMENT
    }

    String id;
    Kind kind;
    /** Role targeted by a ROLE query, null otherwise. */
    Role role;

    @Singular
    List<String> companyVariations;

    @Singular
    List<String> titleFilters;

    @Singular
    List<String> departmentFilters;

    @Singular
    List<String> excludedHeadlineTerms;

    /** Non-corporate employer terms the current company must not contain. */
    @Singular
    List<String> excludedCompanyTerms;

    int resultLimit;
    int estimatedCredits;

    public boolean isBroad() {
        return kind == Kind.BROAD;
    }
}
