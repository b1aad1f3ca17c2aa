package dev.buyergroup.service;

import dev.buyergroup.config.PipelineConfig;
import dev.buyergroup.config.ProviderConfig;
import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SearchQuery;
import dev.buyergroup.model.SellerProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Service turning a target company and seller profile into an ordered, capped list of
 * provider searches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryBuilder {

    private final ProviderConfig providerConfig;
    private final PipelineConfig pipelineConfig;
    private final RulesConfig rulesConfig;

    /**
     * Build the search plan for a company.
     * The first query is always the broad company-only fallback; role queries follow in
     * role priority order, then gatekeeping, target and adjacent department queries.
     *
     * @param companyName Target company name
     * @param aliases     Extra aliases for this company (merged with the profile's aliases)
     * @param profile     Seller profile
     * @param maxQueries  Query cap; 0 or less uses the configured default
     * @return Deterministic query list, never empty, never longer than the cap
     */
    public List<SearchQuery> build(String companyName, List<String> aliases, SellerProfile profile, int maxQueries) {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("Company name is required");
        }
        int cap = Math.max(1, maxQueries > 0 ? maxQueries : pipelineConfig.getMaxQueries());
        List<String> variations = CompanyNames.variations(companyName, mergeAliases(aliases, profile));
        List<String> companyExclusions = nonCorporateExclusions(companyName);

        List<SearchQuery> queries = new ArrayList<>();

        // 1. Broad company-only fallback
        queries.add(baseQuery(variations, companyExclusions, queries.size(), SearchQuery.Kind.BROAD, "broad")
                .build());

        // 2. Role title filters
        for (Role role : Role.values()) {
            List<String> patterns = profile.patternsFor(role);
            if (patterns.isEmpty()) {
                continue;
            }
            queries.add(baseQuery(variations, companyExclusions, queries.size(), SearchQuery.Kind.ROLE,
                    "role-" + role.name().toLowerCase(Locale.ROOT))
                    .role(role)
                    .titleFilters(patterns)
                    .build());
        }

        // 3. Gatekeeping departments (Blocker source)
        queries.add(baseQuery(variations, companyExclusions, queries.size(), SearchQuery.Kind.DEPARTMENT,
                "dept-gatekeeping")
                .role(Role.BLOCKER)
                .departmentFilters(rulesConfig.getGatekeepingDepartments())
                .build());

        // 4. Target departments, one query each
        for (String department : profile.getTargetDepartments()) {
            queries.add(baseQuery(variations, companyExclusions, queries.size(), SearchQuery.Kind.DEPARTMENT,
                    "dept-" + slug(department))
                    .departmentFilter(department)
                    .build());
        }

        // 5. Adjacent departments bundled
        if (!profile.getAdjacentDepartments().isEmpty()) {
            queries.add(baseQuery(variations, companyExclusions, queries.size(), SearchQuery.Kind.DEPARTMENT,
                    "dept-adjacent")
                    .departmentFilters(profile.getAdjacentDepartments())
                    .build());
        }

        List<SearchQuery> capped = queries.size() > cap ? List.copyOf(queries.subList(0, cap)) : List.copyOf(queries);
        log.info("Built {} search queries for '{}' ({} planned, cap {}, {} name variations, ~{} credits)",
                capped.size(), companyName, queries.size(), cap, variations.size(), estimateCredits(capped));
        return capped;
    }

    /**
     * Total credit cost of issuing every query in the plan.
     */
    public int estimateCredits(List<SearchQuery> queries) {
        return queries.stream().mapToInt(SearchQuery::getEstimatedCredits).sum();
    }

    private SearchQuery.SearchQueryBuilder baseQuery(List<String> variations, List<String> companyExclusions,
                                                     int index, SearchQuery.Kind kind, String label) {
        return SearchQuery.builder()
                .id(String.format("q%02d-%s", index, label))
                .kind(kind)
                .companyVariations(variations)
                .excludedHeadlineTerms(rulesConfig.getExcludedHeadlineTerms())
                .excludedCompanyTerms(companyExclusions)
                .resultLimit(providerConfig.getResultLimit())
                .estimatedCredits(providerConfig.getSearchCreditCost());
    }

    /**
     * Non-corporate terms, minus those the target's own name contains ("Mayo Clinic Hospital").
     */
    private List<String> nonCorporateExclusions(String companyName) {
        String normalized = TextNormalizer.normalize(companyName);
        return rulesConfig.getNonCorporateTerms().stream()
                .filter(term -> !TextNormalizer.containsPhrase(normalized, TextNormalizer.normalize(term)))
                .toList();
    }

    private List<String> mergeAliases(List<String> aliases, SellerProfile profile) {
        Set<String> merged = new LinkedHashSet<>();
        if (aliases != null) {
            merged.addAll(aliases);
        }
        merged.addAll(profile.getCompanyAliases());
        return new ArrayList<>(merged);
    }

    private String slug(String value) {
        return TextNormalizer.normalize(value).replace(' ', '-');
    }
}
