package dev.buyergroup.service;

import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SeniorityLevel;
import dev.buyergroup.service.EnterpriseOverrides.ForcedRole;
import dev.buyergroup.support.TestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EnterpriseOverridesTest {

    private final EnterpriseOverrides overrides = new EnterpriseOverrides(new RulesConfig());

    private PersonProfile profile(String title, SeniorityLevel seniority) {
        return TestData.analyzed("p1", title, null, seniority, 12);
    }

    @Test
    @DisplayName("Executive Assistant to the CEO should be an Introducer")
    void executiveAssistantShouldBeIntroducer() {
        Optional<ForcedRole> forced = overrides.apply(profile("Executive Assistant to the CEO", SeniorityLevel.IC));

        assertThat(forced).isPresent();
        assertThat(forced.get().role()).isEqualTo(Role.INTRODUCER);
        assertThat(forced.get().reason()).contains("assistant");
    }

    @ParameterizedTest
    @CsvSource({
            "Account Executive, IC",
            "Senior Account Executive, IC",
            "Inside Sales Representative, IC",
            "SDR Team Lead, MANAGER"
    })
    void frontLineSellersShouldBeIntroducers(String title, SeniorityLevel seniority) {
        assertThat(overrides.apply(profile(title, seniority)))
                .map(ForcedRole::role)
                .contains(Role.INTRODUCER);
    }

    @ParameterizedTest
    @CsvSource({
            "'Regional Vice President, EMEA', VP, emea",
            "'Vice President, Sales Canada', VP, canada",
            "VP Sales Operations, VP, operations",
            "'Senior Director, Sales Enablement', SENIOR_DIRECTOR, enablement"
    })
    void scopedLeadersShouldBeStakeholders(String title, SeniorityLevel seniority, String term) {
        Optional<ForcedRole> forced = overrides.apply(profile(title, seniority));

        assertThat(forced).isPresent();
        assertThat(forced.get().role()).isEqualTo(Role.STAKEHOLDER);
        assertThat(forced.get().reason()).contains(term);
    }

    @ParameterizedTest
    @CsvSource({
            "VP Sales, VP",
            "Chief Operating Officer, C_LEVEL",
            "'Director, Territory Sales', DIRECTOR",
            "'Sales Manager, Canada', MANAGER"
    })
    void otherTitlesShouldNotBeOverridden(String title, SeniorityLevel seniority) {
        assertThat(overrides.apply(profile(title, seniority))).isEmpty();
    }

    @Test
    void shouldIgnoreMissingTitle() {
        assertThat(overrides.apply(profile(null, SeniorityLevel.IC))).isEmpty();
    }
}
