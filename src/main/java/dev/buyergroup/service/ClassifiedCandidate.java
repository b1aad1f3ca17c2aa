package dev.buyergroup.service;

import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.RoleAssignment;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A qualified profile with a score for every role it is eligible for.
 *
 * @param profile   Analyzed profile
 * @param bestRole  Highest scoring role, ties broken by role priority
 * @param scores    Score per eligible role
 * @param rationale Audit lines per eligible role
 */
public record ClassifiedCandidate(
        PersonProfile profile,
        Role bestRole,
        Map<Role, Double> scores,
        Map<Role, List<String>> rationale) {

    /** Score desc, then person id asc. */
    public static final Comparator<ClassifiedCandidate> BY_BEST_SCORE = Comparator
            .comparingDouble(ClassifiedCandidate::bestScore).reversed()
            .thenComparing(ClassifiedCandidate::id);

    public String id() {
        return profile.getId();
    }

    public double bestScore() {
        return scores.get(bestRole);
    }

    public boolean eligibleFor(Role role) {
        return scores.containsKey(role);
    }

    public double scoreFor(Role role) {
        return scores.getOrDefault(role, 0.0);
    }

    /**
     * Score desc, then person id asc, for a given role.
     */
    public static Comparator<ClassifiedCandidate> byScoreFor(Role role) {
        return Comparator.comparingDouble((ClassifiedCandidate c) -> c.scoreFor(role)).reversed()
                .thenComparing(ClassifiedCandidate::id);
    }

    public RoleAssignment toAssignment(Role role) {
        return RoleAssignment.builder()
                .personId(profile.getId())
                .fullName(profile.getFullName())
                .title(profile.getCurrentTitle())
                .department(profile.getCurrentDepartment())
                .seniorityLevel(profile.getSeniorityLevel())
                .role(role)
                .score(scoreFor(role))
                .rationale(rationale.getOrDefault(role, List.of()))
                .build();
    }
}
