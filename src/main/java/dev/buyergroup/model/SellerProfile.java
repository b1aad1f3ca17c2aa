package dev.buyergroup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable description of a sales motion: what is sold, to whom and at what deal size.
 * Built once per profile by the registry and never mutated at runtime.
 */
@Value
@Builder(toBuilder = true)
public class SellerProfile {

    String name;
    String productName;
    String solutionCategory;

    @Singular
    Map<Role, List<String>> rolePatterns;

    @Singular
    List<String> targetDepartments;

    @Singular
    List<String> adjacentDepartments;

    @Singular("companyAlias")
    List<String> companyAliases;

    DealSizeClass dealSizeClass;

    @Singular
    Map<Role, Integer> minRoleTargets;

    @Singular
    Map<Role, Integer> roleCaps;

    int maxBuyerGroupSize;

    @Builder.Default
    SeniorityLevel minimumSeniority = SeniorityLevel.IC;

    public List<String> patternsFor(Role role) {
        return rolePatterns.getOrDefault(role, List.of());
    }

    public int minTarget(Role role) {
        return minRoleTargets.getOrDefault(role, 0);
    }

    public int cap(Role role) {
        return roleCaps.getOrDefault(role, maxBuyerGroupSize);
    }

    public int minTargetSum() {
        return minRoleTargets.values().stream().mapToInt(Integer::intValue).sum();
    }
}
