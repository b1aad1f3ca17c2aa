package dev.buyergroup.service;

import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.Experience;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import dev.buyergroup.service.ProfileAnalyzer.AnalysisResult;
import dev.buyergroup.service.ProfileAnalyzer.Target;
import dev.buyergroup.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileAnalyzerTest {

    private ProfileAnalyzer analyzer;
    private Target dell;
    private SellerProfile sellerProfile;

    @BeforeEach
    void setUp() {
        RulesConfig rules = new RulesConfig();
        analyzer = new ProfileAnalyzer(rules, new EnterpriseOverrides(rules), TestData.FIXED_CLOCK);
        dell = Target.of("Dell Technologies", List.of("Dell", "Dell EMC"));
        sellerProfile = TestData.revenueProfile();
    }

    @Nested
    @DisplayName("Quality filters")
    class QualityFilterTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "Director, Legal",
                "Director of Procurement",
                "Senior Director, Information Security",
                "Finance Director",
                "VP, Legal"
        })
        @DisplayName("Gatekeeping Director+ profiles should always reach the classifier")
        void gatekeepersShouldNeverBeExcluded(String title) {
            SellerProfile strict = sellerProfile.toBuilder().minimumSeniority(SeniorityLevel.SVP).build();

            AnalysisResult result = analyzer.analyze(TestData.person("p1", title, "Dell EMC"), dell, strict);

            assertThat(result.accepted()).isTrue();
            assertThat(result.exclusionReason()).isNull();
            assertThat(analyzer.isGatekeepingDepartment(result.profile().getCurrentDepartment())).isTrue();
        }

        @Test
        void shouldExcludeBelowSeniorityFloor() {
            SellerProfile strict = sellerProfile.toBuilder().minimumSeniority(SeniorityLevel.VP).build();

            AnalysisResult result = analyzer.analyze(TestData.person("p1", "Sales Manager", "Dell"), dell, strict);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).isEqualTo("seniority MANAGER below VP");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "Executive Assistant to the CEO",
                "Assistant to the CFO",
                "Account Executive",
                "Sales Development Representative"
        })
        @DisplayName("Introducer titles should pass any seniority floor")
        void introducerTitlesShouldSkipSeniorityFloor(String title) {
            RulesConfig rules = new RulesConfig();
            RoleScorer scorer = new RoleScorer(new TitleMatcher(), new EnterpriseOverrides(rules), analyzer);
            SellerProfile strict = sellerProfile.toBuilder().minimumSeniority(SeniorityLevel.MANAGER).build();

            AnalysisResult result = analyzer.analyze(TestData.person("p1", title, "Dell Technologies"), dell, strict);

            assertThat(result.accepted()).isTrue();
            assertThat(result.profile().getSeniorityLevel()).isEqualTo(SeniorityLevel.IC);
            assertThat(scorer.classify(result.profile(), strict, ScoringStrategy.defaults()))
                    .map(ClassifiedCandidate::bestRole)
                    .contains(Role.INTRODUCER);
        }

        @Test
        void shouldExcludeInterns() {
            AnalysisResult result = analyzer.analyze(
                    TestData.person("p1", "Sales Intern", "Dell Technologies"), dell, sellerProfile);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).isEqualTo("excluded title term: intern");
        }

        @Test
        void shouldExcludeOtherCompanies() {
            AnalysisResult result = analyzer.analyze(
                    TestData.person("p1", "Director of Sales", "Dellwood Partners"), dell, sellerProfile);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).contains("is not Dell Technologies");
        }

        @Test
        void shouldExcludeNonCorporateEmployers() {
            AnalysisResult result = analyzer.analyze(
                    TestData.person("p1", "Director of Sales", "Dell Technologies University"), dell, sellerProfile);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).startsWith("non-corporate employer");
        }

        @Test
        void shouldExcludeProfilesWithoutCurrentExperience() {
            PersonProfile formerEmployee = PersonProfile.builder()
                    .id("p1")
                    .experiences(List.of(Experience.builder()
                            .company("Dell Technologies")
                            .title("VP Sales")
                            .startDate(LocalDate.of(2015, 1, 1))
                            .endDate(LocalDate.of(2019, 12, 1))
                            .build()))
                    .build();

            AnalysisResult result = analyzer.analyze(formerEmployee, dell, sellerProfile);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).isEqualTo("no current experience");
        }

        @Test
        void shouldExcludeMissingTitle() {
            AnalysisResult result = analyzer.analyze(
                    TestData.person("p1", null, "Dell Technologies"), dell, sellerProfile);

            assertThat(result.accepted()).isFalse();
            assertThat(result.exclusionReason()).isEqualTo("missing title");
        }

        @Test
        @DisplayName("Should derive the canonical fields of accepted profiles")
        void shouldDeriveCanonicalFields() {
            PersonProfile raw = TestData.person("p1", "VP Sales", "Dell Technologies", "Sales ",
                    LocalDate.of(2022, 6, 1));

            AnalysisResult result = analyzer.analyze(raw, dell, sellerProfile);

            assertThat(result.accepted()).isTrue();
            PersonProfile profile = result.profile();
            assertThat(profile.getCurrentTitle()).isEqualTo("VP Sales");
            assertThat(profile.getCurrentDepartment()).isEqualTo("sales");
            assertThat(profile.getCurrentCompany()).isEqualTo("Dell Technologies");
            assertThat(profile.getSeniorityLevel()).isEqualTo(SeniorityLevel.VP);
            assertThat(profile.getTenureMonths()).isEqualTo(36);
            assertThat(raw.getCurrentTitle()).isNull();
        }
    }

    @Nested
    @DisplayName("Current experience")
    class CurrentExperienceTests {

        private Experience job(String title, LocalDate start, LocalDate end, Boolean current) {
            return Experience.builder().company("Dell").title(title).startDate(start).endDate(end).current(current).build();
        }

        @Test
        void shouldPreferOpenEndedEntry() {
            Experience past = job("Manager", LocalDate.of(2015, 1, 1), LocalDate.of(2019, 1, 1), null);
            Experience present = job("Director", LocalDate.of(2021, 1, 1), null, null);

            assertThat(analyzer.currentExperience(List.of(past, present))).contains(present);
        }

        @Test
        void shouldPickLatestStartAmongCurrentEntries() {
            Experience board = job("Board Member", LocalDate.of(2018, 1, 1), null, true);
            Experience role = job("VP Sales", LocalDate.of(2022, 3, 1), null, true);

            assertThat(analyzer.currentExperience(List.of(board, role))).contains(role);
        }

        @Test
        void shouldKeepListOrderOnTies() {
            Experience first = job("VP Sales", LocalDate.of(2022, 3, 1), null, true);
            Experience second = job("Advisor", LocalDate.of(2022, 3, 1), null, true);

            assertThat(analyzer.currentExperience(List.of(first, second))).contains(first);
        }

        @Test
        void shouldAcceptEntryEndingInTheFuture() {
            Experience contract = job("Director", LocalDate.of(2024, 1, 1), LocalDate.of(2026, 1, 1), null);

            assertThat(analyzer.currentExperience(List.of(contract))).contains(contract);
        }

        @Test
        void shouldReturnEmptyWhenEverythingEnded() {
            Experience old = job("Manager", LocalDate.of(2015, 1, 1), LocalDate.of(2019, 1, 1), null);
            Experience recent = job("Director", LocalDate.of(2019, 2, 1), LocalDate.of(2024, 12, 1), null);

            assertThat(analyzer.currentExperience(List.of(old, recent))).isEmpty();
        }

        @Test
        void shouldReturnEmptyForNoExperience() {
            assertThat(analyzer.currentExperience(List.of())).isEqualTo(Optional.empty());
            assertThat(analyzer.currentExperience(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Seniority and department")
    class SeniorityTests {

        @ParameterizedTest
        @CsvSource({
                "Chief Revenue Officer, C_LEVEL",
                "CTO, C_LEVEL",
                "President, C_LEVEL",
                "Co-Founder, C_LEVEL",
                "Senior Vice President of Sales, SVP",
                "EVP Operations, SVP",
                "'Vice President, Sales', VP",
                "VP Marketing, VP",
                "'Sr. Director, Procurement', SENIOR_DIRECTOR",
                "Head of Legal, DIRECTOR",
                "Director, DIRECTOR",
                "Sales Manager, MANAGER",
                "Lead Engineer, MANAGER",
                "Account Executive, IC",
                "Executive Assistant to the CEO, IC",
                "Chief of Staff, MANAGER",
                "Chief of Staff to the CEO, MANAGER"
        })
        void shouldDeriveSeniorityFromTitle(String title, SeniorityLevel expected) {
            assertThat(analyzer.seniorityOf(title)).isEqualTo(expected);
        }

        @ParameterizedTest
        @CsvSource({
                "General Counsel, legal",
                "VP Marketing, marketing",
                "Chief Revenue Officer, sales",
                "Director of Revenue Operations, sales",
                "Software Engineer, engineering",
                "Chief Information Security Officer, security"
        })
        void shouldInferDepartmentFromTitle(String title, String expected) {
            assertThat(analyzer.inferDepartment(title)).isEqualTo(expected);
        }

        @Test
        void seniorityFloorShouldBeCappedForGatekeepers() {
            assertThat(analyzer.seniorityFloor("legal", SeniorityLevel.SVP)).isEqualTo(SeniorityLevel.MANAGER);
            assertThat(analyzer.seniorityFloor("sales", SeniorityLevel.SVP)).isEqualTo(SeniorityLevel.SVP);
            assertThat(analyzer.seniorityFloor("legal", SeniorityLevel.IC)).isEqualTo(SeniorityLevel.IC);
        }
    }
}
