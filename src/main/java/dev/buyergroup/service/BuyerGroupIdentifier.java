package dev.buyergroup.service;

import dev.buyergroup.model.BuyerGroup;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.service.BuyerGroupSelector.Selection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service that classifies qualified profiles and assembles the final buyer group.
 * Pure and single-threaded: the same inputs always give the same group in the same order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BuyerGroupIdentifier {

    private final RoleScorer roleScorer;
    private final BuyerGroupSelector selector;
    private final GroupDynamicsCalculator dynamicsCalculator;

    /**
     * Result of group assembly.
     */
    public record Identification(BuyerGroup buyerGroup, List<String> warnings) {
    }

    /**
     * Classify profiles in person id order. Profiles without any applicable role are dropped.
     */
    public List<ClassifiedCandidate> classify(List<PersonProfile> profiles, SellerProfile sellerProfile,
                                              ScoringStrategy strategy) {
        List<ClassifiedCandidate> classified = new ArrayList<>();
        profiles.stream()
                .sorted(Comparator.comparing(PersonProfile::getId))
                .forEach(profile -> roleScorer.classify(profile, sellerProfile, strategy).ifPresent(classified::add));
        log.info("Classified {} of {} qualified profiles", classified.size(), profiles.size());
        return classified;
    }

    /**
     * Select members and compute dynamics.
     *
     * @param maxGroupSize Effective maximum group size for this run
     */
    public Identification assemble(String companyName, List<ClassifiedCandidate> classified,
                                   SellerProfile sellerProfile, int maxGroupSize) {
        Selection selection = selector.select(classified, sellerProfile, maxGroupSize);
        BuyerGroup group = new BuyerGroup(companyName, selection.roles(),
                dynamicsCalculator.calculate(selection.roles(), sellerProfile, maxGroupSize));
        log.info("Buyer group for {}: {} members {}", companyName, group.getTotalMembers(), countsOf(group));
        return new Identification(group, selection.warnings());
    }

    /**
     * Whether every minimum role target can already be met from the classified candidates,
     * counting each candidate once under its best role.
     */
    public boolean minimumsMet(List<ClassifiedCandidate> classified, SellerProfile sellerProfile) {
        Map<Role, Integer> counts = new EnumMap<>(Role.class);
        classified.forEach(candidate -> counts.merge(candidate.bestRole(), 1, Integer::sum));
        for (Role role : Role.values()) {
            if (counts.getOrDefault(role, 0) < Math.min(sellerProfile.minTarget(role), sellerProfile.cap(role))) {
                return false;
            }
        }
        return true;
    }

    private Map<Role, Integer> countsOf(BuyerGroup group) {
        Map<Role, Integer> counts = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            counts.put(role, group.count(role));
        }
        return counts;
    }
}
