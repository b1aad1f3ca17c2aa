package dev.buyergroup.service;

import dev.buyergroup.config.PipelineConfig;
import dev.buyergroup.config.ProviderConfig;
import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SearchQuery;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryBuilderTest {

    private QueryBuilder queryBuilder;
    private SellerProfile profile;

    @BeforeEach
    void setUp() {
        queryBuilder = new QueryBuilder(new ProviderConfig(), new PipelineConfig(), new RulesConfig());
        profile = TestData.revenueProfile();
    }

    @Test
    @DisplayName("Should plan broad, role, gatekeeping, target and adjacent queries in order")
    void shouldPlanQueriesInOrder() {
        List<SearchQuery> queries = queryBuilder.build("Dell Technologies", List.of("Dell", "Dell EMC"), profile, 0);

        assertThat(queries).extracting(SearchQuery::getId).containsExactly(
                "q00-broad",
                "q01-role-decision",
                "q02-role-champion",
                "q03-role-stakeholder",
                "q04-role-blocker",
                "q05-role-introducer",
                "q06-dept-gatekeeping",
                "q07-dept-sales",
                "q08-dept-revenue-operations",
                "q09-dept-adjacent");
    }

    @Test
    @DisplayName("The broad query should carry only the company filter")
    void broadQueryShouldHaveNoTitleOrDepartmentFilters() {
        SearchQuery broad = queryBuilder.build("Dell Technologies", List.of("Dell EMC"), profile, 0).get(0);

        assertThat(broad.isBroad()).isTrue();
        assertThat(broad.getTitleFilters()).isEmpty();
        assertThat(broad.getDepartmentFilters()).isEmpty();
        assertThat(broad.getCompanyVariations()).containsExactly("Dell Technologies", "Dell EMC", "Dell", "Dell Inc");
        assertThat(broad.getExcludedHeadlineTerms()).contains("former", "ex-", "retired", "intern");
        assertThat(broad.getResultLimit()).isEqualTo(25);
        assertThat(broad.getEstimatedCredits()).isEqualTo(1);
    }

    @Test
    void roleQueriesShouldCarryThePatterns() {
        List<SearchQuery> queries = queryBuilder.build("Dell Technologies", List.of(), profile, 0);

        SearchQuery decision = queries.get(1);
        assertThat(decision.getRole()).isEqualTo(Role.DECISION);
        assertThat(decision.getTitleFilters()).containsExactly("chief revenue officer", "vp sales", "vice president sales");

        SearchQuery gatekeeping = queries.get(6);
        assertThat(gatekeeping.getRole()).isEqualTo(Role.BLOCKER);
        assertThat(gatekeeping.getDepartmentFilters()).contains("legal", "procurement", "security");
    }

    @Test
    void shouldCapTheQueryCount() {
        List<SearchQuery> queries = queryBuilder.build("Dell Technologies", List.of(), profile, 3);

        assertThat(queries).hasSize(3);
        assertThat(queries.get(0).isBroad()).isTrue();
        assertThat(queryBuilder.estimateCredits(queries)).isEqualTo(3);
    }

    @Test
    @DisplayName("Non-corporate terms in the target's own name should not be excluded")
    void shouldKeepNonCorporateTermsOfTheTarget() {
        SearchQuery broad = queryBuilder.build("Mayo Clinic Hospital", List.of(), profile, 1).get(0);

        assertThat(broad.getExcludedCompanyTerms()).doesNotContain("hospital").contains("university");
    }

    @Test
    void shouldBeDeterministic() {
        List<SearchQuery> first = queryBuilder.build("Dell Technologies", List.of("Dell"), profile, 0);
        List<SearchQuery> second = queryBuilder.build("Dell Technologies", List.of("Dell"), profile, 0);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void shouldRejectBlankCompany() {
        assertThatThrownBy(() -> queryBuilder.build(" ", List.of(), profile, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
