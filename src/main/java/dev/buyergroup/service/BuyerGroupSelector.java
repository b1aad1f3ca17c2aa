package dev.buyergroup.service;

import dev.buyergroup.model.ReportWarning;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.RoleAssignment;
import dev.buyergroup.model.SellerProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills the buyer group seats from classified candidates.
 * Minimums first, then best remaining scores, then one rebalancing pass that borrows from
 * adjacent roles for any role still short of its minimum. Caps and the maximum group size
 * are never exceeded.
 */
@Slf4j
@Component
public class BuyerGroupSelector {

    /**
     * Selected members per role plus the warnings raised for unfilled roles.
     */
    public record Selection(Map<Role, List<RoleAssignment>> roles, List<String> warnings) {

        public int totalMembers() {
            return roles.values().stream().mapToInt(List::size).sum();
        }
    }

    public Selection select(List<ClassifiedCandidate> candidates, SellerProfile profile, int maxGroupSize) {
        SeatPlan plan = new SeatPlan(profile, maxGroupSize);

        Map<Role, List<ClassifiedCandidate>> buckets = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            buckets.put(role, new ArrayList<>());
        }
        candidates.forEach(candidate -> buckets.get(candidate.bestRole()).add(candidate));
        buckets.values().forEach(bucket -> bucket.sort(ClassifiedCandidate.BY_BEST_SCORE));

        // 1. Minimums in role priority order
        for (Role role : Role.values()) {
            int wanted = Math.min(profile.minTarget(role), plan.cap(role));
            for (ClassifiedCandidate candidate : buckets.get(role)) {
                if (plan.count(role) >= wanted || plan.isFull()) {
                    break;
                }
                plan.add(role, candidate);
            }
        }

        // 2. Remaining seats by global score
        List<ClassifiedCandidate> remaining = new ArrayList<>();
        buckets.values().forEach(bucket -> bucket.stream().filter(c -> !plan.contains(c)).forEach(remaining::add));
        remaining.sort(ClassifiedCandidate.BY_BEST_SCORE);
        for (ClassifiedCandidate candidate : remaining) {
            if (plan.isFull()) {
                break;
            }
            if (plan.count(candidate.bestRole()) < plan.cap(candidate.bestRole())) {
                plan.add(candidate.bestRole(), candidate);
            }
        }

        // 3. One rebalancing pass
        for (Role role : Role.values()) {
            rebalance(role, plan, buckets, profile);
        }

        List<String> warnings = new ArrayList<>();
        for (Role role : Role.values()) {
            int minimum = profile.minTarget(role);
            if (minimum <= 0) {
                continue;
            }
            if (plan.count(role) == 0) {
                warnings.add(ReportWarning.ROLE_GAP_UNFILLED.format(
                        "no qualified " + role.getDisplayName() + " found (minimum " + minimum + ")"));
            } else if (plan.count(role) < minimum) {
                warnings.add(ReportWarning.ROLE_BELOW_TARGET.format(
                        role.getDisplayName() + " has " + plan.count(role) + " of " + minimum + " required"));
            }
        }

        log.debug("Selected {} members (max {}): {}", plan.total(), plan.maxSize, plan.counts());
        return new Selection(plan.toAssignments(), warnings);
    }

    private void rebalance(Role role, SeatPlan plan, Map<Role, List<ClassifiedCandidate>> buckets,
                           SellerProfile profile) {
        int wanted = Math.min(profile.minTarget(role), plan.cap(role));
        if (plan.count(role) >= wanted) {
            return;
        }

        // Donors: overflow from adjacent buckets, or members of adjacent roles above their minimum
        List<ClassifiedCandidate> donors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Role adjacent : role.adjacentRoles()) {
            for (ClassifiedCandidate candidate : buckets.get(adjacent)) {
                if (candidate.eligibleFor(role) && seen.add(candidate.id())) {
                    donors.add(candidate);
                }
            }
            for (ClassifiedCandidate member : plan.members(adjacent)) {
                if (member.eligibleFor(role) && seen.add(member.id())) {
                    donors.add(member);
                }
            }
        }
        donors.sort(ClassifiedCandidate.byScoreFor(role));

        for (ClassifiedCandidate donor : donors) {
            if (plan.count(role) >= wanted) {
                return;
            }
            Role current = plan.roleOf(donor);
            if (current == role) {
                continue;
            }
            if (current != null) {
                if (plan.count(current) > profile.minTarget(current)) {
                    plan.move(donor, current, role);
                    log.debug("Rebalanced {} from {} to {}", donor.id(), current, role);
                }
                continue;
            }
            if (plan.isFull() && !plan.evictLowest(role, profile)) {
                return;
            }
            plan.add(role, donor);
            log.debug("Rebalanced overflow {} into {}", donor.id(), role);
        }
    }

    /**
     * Mutable seat assignment used while selecting.
     */
    private static final class SeatPlan {

        private final SellerProfile profile;
        private final int maxSize;
        private final Map<Role, List<ClassifiedCandidate>> seats = new EnumMap<>(Role.class);
        private final Map<String, Role> roleById = new HashMap<>();

        SeatPlan(SellerProfile profile, int maxSize) {
            this.profile = profile;
            this.maxSize = maxSize;
            for (Role role : Role.values()) {
                seats.put(role, new ArrayList<>());
            }
        }

        int cap(Role role) {
            return Math.min(profile.cap(role), maxSize);
        }

        int count(Role role) {
            return seats.get(role).size();
        }

        int total() {
            return roleById.size();
        }

        boolean isFull() {
            return total() >= maxSize;
        }

        boolean contains(ClassifiedCandidate candidate) {
            return roleById.containsKey(candidate.id());
        }

        Role roleOf(ClassifiedCandidate candidate) {
            return roleById.get(candidate.id());
        }

        List<ClassifiedCandidate> members(Role role) {
            return List.copyOf(seats.get(role));
        }

        void add(Role role, ClassifiedCandidate candidate) {
            seats.get(role).add(candidate);
            roleById.put(candidate.id(), role);
        }

        void move(ClassifiedCandidate candidate, Role from, Role to) {
            seats.get(from).remove(candidate);
            add(to, candidate);
        }

        /**
         * Free one seat by dropping the lowest scored member of a role above its minimum.
         */
        boolean evictLowest(Role filling, SellerProfile profile) {
            ClassifiedCandidate lowest = null;
            Role lowestRole = null;
            for (Role role : Role.values()) {
                if (role == filling || count(role) <= profile.minTarget(role)) {
                    continue;
                }
                for (ClassifiedCandidate member : seats.get(role)) {
                    if (lowest == null || isLower(member, role, lowest, lowestRole)) {
                        lowest = member;
                        lowestRole = role;
                    }
                }
            }
            if (lowest == null) {
                return false;
            }
            seats.get(lowestRole).remove(lowest);
            roleById.remove(lowest.id());
            log.debug("Evicted {} from {} to make room for {}", lowest.id(), lowestRole, filling);
            return true;
        }

        private boolean isLower(ClassifiedCandidate a, Role aRole, ClassifiedCandidate b, Role bRole) {
            int byScore = Double.compare(a.scoreFor(aRole), b.scoreFor(bRole));
            return byScore < 0 || (byScore == 0 && a.id().compareTo(b.id()) > 0);
        }

        Map<Role, Integer> counts() {
            Map<Role, Integer> counts = new EnumMap<>(Role.class);
            seats.forEach((role, members) -> counts.put(role, members.size()));
            return counts;
        }

        Map<Role, List<RoleAssignment>> toAssignments() {
            Map<Role, List<RoleAssignment>> result = new EnumMap<>(Role.class);
            seats.forEach((role, members) -> result.put(role, members.stream()
                    .sorted(ClassifiedCandidate.byScoreFor(role))
                    .map(member -> member.toAssignment(role))
                    .toList()));
            return result;
        }
    }
}
