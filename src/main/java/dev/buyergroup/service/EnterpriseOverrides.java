package dev.buyergroup.service;

import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SeniorityLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Title rules that force a single role regardless of pattern matches.
 * Rules are checked in order and the first one that fires wins.
 */
@Component
@RequiredArgsConstructor
public class EnterpriseOverrides {

    private final RulesConfig rulesConfig;

    /**
     * @param role   Forced role
     * @param reason Rationale line for the assignment
     */
    public record ForcedRole(Role role, String reason) {
    }

    public Optional<ForcedRole> apply(PersonProfile profile) {
        String title = profile.getCurrentTitle();
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        SeniorityLevel seniority = profile.getSeniorityLevel() != null ? profile.getSeniorityLevel() : SeniorityLevel.IC;

        // 1. Assistants
        Optional<String> assistant = firstTerm(title, rulesConfig.getAssistantTerms());
        if (assistant.isPresent()) {
            return Optional.of(new ForcedRole(Role.INTRODUCER, "override: assistant title ('" + assistant.get() + "')"));
        }

        // 2. Front-line sellers
        if (!seniority.isAtLeast(SeniorityLevel.DIRECTOR)) {
            Optional<String> frontLine = firstTerm(title, rulesConfig.getFrontLineTerms());
            if (frontLine.isPresent()) {
                return Optional.of(new ForcedRole(Role.INTRODUCER,
                        "override: front-line title ('" + frontLine.get() + "')"));
            }
        }

        // 3. Regional or process-scoped leaders in the Director..SVP band
        if (seniority.isAtLeast(SeniorityLevel.DIRECTOR) && !seniority.isAtLeast(SeniorityLevel.C_LEVEL)) {
            Optional<String> scope = firstTerm(title, rulesConfig.getRegionalTerms())
                    .or(() -> firstTerm(title, rulesConfig.getProcessTerms()));
            if (scope.isPresent()) {
                return Optional.of(new ForcedRole(Role.STAKEHOLDER,
                        "override: " + seniority + " with regional or process scope ('" + scope.get() + "')"));
            }
        }

        return Optional.empty();
    }

    /**
     * Whether the first firing rule makes the profile an Introducer.
     */
    public boolean forcesIntroducer(PersonProfile profile) {
        return apply(profile).map(forced -> forced.role() == Role.INTRODUCER).orElse(false);
    }

    private Optional<String> firstTerm(String title, Iterable<String> terms) {
        for (String term : terms) {
            if (TextNormalizer.containsWord(title, term)) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }
}
