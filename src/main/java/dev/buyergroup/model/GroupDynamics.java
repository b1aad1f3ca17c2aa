package dev.buyergroup.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary metrics describing how hard the buying committee will be to navigate.
 */
@Value
@Builder
public class GroupDynamics {
    /** Share of members in the largest single department, 0..1. */
    double cohesion;
    RiskLevel riskLevel;
    /** 0..100, grows with member count and department spread. */
    int decisionComplexity;
    /** Share of members at Director level or above, 0..1. */
    double powerDistribution;
    int departmentCount;

    public static GroupDynamics empty() {
        return GroupDynamics.builder()
                .cohesion(0)
                .riskLevel(RiskLevel.HIGH)
                .decisionComplexity(0)
                .powerDistribution(0)
                .departmentCount(0)
                .build();
    }
}
