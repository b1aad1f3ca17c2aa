package dev.buyergroup.service;

import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import dev.buyergroup.service.EnterpriseOverrides.ForcedRole;
import dev.buyergroup.service.TitleMatcher.TitleMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service that decides which roles a qualified profile is eligible for and scores each one.
 * score = 100 x (seniority + department + title strength + tenure), each weighted by the strategy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleScorer {

    private final TitleMatcher titleMatcher;
    private final EnterpriseOverrides enterpriseOverrides;
    private final ProfileAnalyzer profileAnalyzer;

    /**
     * Classify one analyzed profile.
     *
     * @param profile       Profile with derived fields
     * @param sellerProfile Patterns, departments and deal size
     * @param strategy      Weights for this run
     * @return the classified candidate, or empty when no role applies
     */
    public Optional<ClassifiedCandidate> classify(PersonProfile profile, SellerProfile sellerProfile,
                                                  ScoringStrategy strategy) {
        Map<Role, Double> strengths = new EnumMap<>(Role.class);
        Map<Role, List<String>> reasons = new EnumMap<>(Role.class);
        SeniorityLevel seniority = profile.getSeniorityLevel() != null ? profile.getSeniorityLevel() : SeniorityLevel.IC;
        boolean gatekeeper = profileAnalyzer.isGatekeepingDepartment(profile.getCurrentDepartment());

        Optional<ForcedRole> override = enterpriseOverrides.apply(profile);
        if (override.isPresent()) {
            strengths.put(override.get().role(), strategy.overrideStrength());
            addReason(reasons, override.get().role(), override.get().reason());
        } else {
            // 1. Pattern matches
            for (Role role : Role.values()) {
                Optional<TitleMatch> match = titleMatcher.match(profile.getCurrentTitle(),
                        sellerProfile.patternsFor(role));
                if (match.isPresent()) {
                    strengths.put(role, match.get().strength());
                    addReason(reasons, role, match.get().describe());
                }
            }

            // 2. Gatekeepers are Blocker-eligible
            if (gatekeeper && seniority.isAtLeast(SeniorityLevel.MANAGER)
                    && strengths.getOrDefault(Role.BLOCKER, 0.0) < strategy.gatekeeperStrength()) {
                strengths.put(Role.BLOCKER, strategy.gatekeeperStrength());
                addReason(reasons, Role.BLOCKER, "gatekeeping department '" + profile.getCurrentDepartment() + "'");
            }

            // 3. Stakeholder fallback
            if (!strengths.containsKey(Role.STAKEHOLDER)
                    && (seniority.isAtLeast(SeniorityLevel.MANAGER)
                    || departmentMatch(profile, sellerProfile, Role.STAKEHOLDER) > 0)) {
                strengths.put(Role.STAKEHOLDER, strategy.fallbackStrength());
                addReason(reasons, Role.STAKEHOLDER, "stakeholder fallback");
            }
        }

        if (strengths.isEmpty()) {
            log.debug("Profile {} ('{}') has no applicable role", profile.getId(), profile.getCurrentTitle());
            return Optional.empty();
        }

        Map<Role, Double> scores = new EnumMap<>(Role.class);
        Role best = null;
        for (Role role : Role.values()) {
            Double strength = strengths.get(role);
            if (strength == null) {
                continue;
            }
            double score = score(profile, sellerProfile, strategy, role, strength, reasons);
            scores.put(role, score);
            if (best == null || score > scores.get(best)) {
                best = role;
            }
        }

        Map<Role, List<String>> frozen = new EnumMap<>(Role.class);
        reasons.forEach((role, lines) -> frozen.put(role, List.copyOf(lines)));
        log.debug("Profile {} ('{}') -> {} ({})", profile.getId(), profile.getCurrentTitle(), best, scores);
        return Optional.of(new ClassifiedCandidate(profile, best,
                Collections.unmodifiableMap(scores), Collections.unmodifiableMap(frozen)));
    }

    private double score(PersonProfile profile, SellerProfile sellerProfile, ScoringStrategy strategy, Role role,
                         double titleStrength, Map<Role, List<String>> reasons) {
        SeniorityLevel seniority = profile.getSeniorityLevel() != null ? profile.getSeniorityLevel() : SeniorityLevel.IC;
        double seniorityPart = (double) seniority.rank() / SeniorityLevel.maxRank();
        double departmentPart = departmentMatch(profile, sellerProfile, role);
        double tenurePart = (double) Math.min(profile.getTenureMonths(), strategy.tenureCapMonths())
                / strategy.tenureCapMonths();

        double score = 100 * (strategy.seniorityWeight() * seniorityPart
                + strategy.departmentWeight() * departmentPart
                + strategy.titleWeight() * titleStrength
                + strategy.tenureWeight() * tenurePart);

        SeniorityLevel authority = sellerProfile.getDealSizeClass().getAuthorityLevel();
        if (role == Role.DECISION && !seniority.isAtLeast(authority)) {
            score *= strategy.authorityPenalty();
            addReason(reasons, role, "below " + authority + " authority for " + sellerProfile.getDealSizeClass() + " deal");
        }
        return Math.round(score * 100) / 100.0;
    }

    /**
     * 1.0 for a target department, 0.5 for an adjacent one, 0 otherwise.
     * For the Blocker role the gatekeeping departments are the primary ones and any seller
     * department counts half.
     */
    double departmentMatch(PersonProfile profile, SellerProfile sellerProfile, Role role) {
        String department = profile.getCurrentDepartment();
        if (department == null || department.isBlank()) {
            return 0.0;
        }
        boolean target = inAny(department, sellerProfile.getTargetDepartments());
        boolean adjacent = inAny(department, sellerProfile.getAdjacentDepartments());
        if (role == Role.BLOCKER) {
            if (profileAnalyzer.isGatekeepingDepartment(department)) {
                return 1.0;
            }
            return target || adjacent ? 0.5 : 0.0;
        }
        if (target) {
            return 1.0;
        }
        return adjacent ? 0.5 : 0.0;
    }

    private boolean inAny(String department, List<String> departments) {
        String normalized = TextNormalizer.normalize(department);
        for (String candidate : departments) {
            String other = TextNormalizer.normalize(candidate);
            if (TextNormalizer.containsPhrase(normalized, other) || TextNormalizer.containsPhrase(other, normalized)) {
                return true;
            }
        }
        return false;
    }

    private void addReason(Map<Role, List<String>> reasons, Role role, String reason) {
        reasons.computeIfAbsent(role, key -> new ArrayList<>()).add(reason);
    }
}
