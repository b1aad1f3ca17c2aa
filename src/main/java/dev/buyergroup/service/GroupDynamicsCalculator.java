package dev.buyergroup.service;

import dev.buyergroup.model.GroupDynamics;
import dev.buyergroup.model.RiskLevel;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.RoleAssignment;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary dynamics of a selected buyer group.
 */
@Component
public class GroupDynamicsCalculator {

    private static final String UNKNOWN_DEPARTMENT = "unknown";

    public GroupDynamics calculate(Map<Role, List<RoleAssignment>> roles, SellerProfile profile, int maxGroupSize) {
        List<RoleAssignment> members = roles.values().stream().flatMap(Collection::stream).toList();
        if (members.isEmpty()) {
            return GroupDynamics.empty();
        }
        int size = members.size();

        Map<String, Integer> byDepartment = new TreeMap<>();
        for (RoleAssignment member : members) {
            String department = member.getDepartment() == null || member.getDepartment().isBlank()
                    ? UNKNOWN_DEPARTMENT : member.getDepartment();
            byDepartment.merge(department, 1, Integer::sum);
        }
        int departments = byDepartment.size();
        int largest = byDepartment.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        long powerful = members.stream()
                .filter(member -> member.getSeniorityLevel() != null
                        && member.getSeniorityLevel().isAtLeast(SeniorityLevel.DIRECTOR))
                .count();

        // 60% group size against the maximum, 40% department spread
        double sizeFactor = Math.min(1.0, (double) size / Math.max(1, maxGroupSize));
        double spreadFactor = (double) departments / size;
        int complexity = (int) Math.round(100 * (0.6 * sizeFactor + 0.4 * spreadFactor));

        RiskLevel risk = RiskLevel.LOW;
        if (roles.getOrDefault(Role.BLOCKER, List.of()).isEmpty()) {
            risk = risk.escalate();
        }
        SeniorityLevel authority = profile.getDealSizeClass().getAuthorityLevel();
        boolean authorizedDecision = roles.getOrDefault(Role.DECISION, List.of()).stream()
                .anyMatch(member -> member.getSeniorityLevel() != null && member.getSeniorityLevel().isAtLeast(authority));
        if (!authorizedDecision) {
            risk = risk.escalate();
        }

        return GroupDynamics.builder()
                .cohesion(round((double) largest / size))
                .riskLevel(risk)
                .decisionComplexity(Math.min(100, complexity))
                .powerDistribution(round((double) powerful / size))
                .departmentCount(departments)
                .build();
    }

    private double round(double value) {
        return Math.round(value * 1000) / 1000.0;
    }
}
