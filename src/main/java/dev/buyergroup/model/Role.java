package dev.buyergroup.model;

import java.util.List;

/**
 * Negotiation roles inside a buyer group.
 * Declaration order is the tie-break priority: DECISION wins over CHAMPION, and so on.
 */
public enum Role {
    DECISION("Decision"),
    CHAMPION("Champion"),
    STAKEHOLDER("Stakeholder"),
    BLOCKER("Blocker"),
    INTRODUCER("Introducer");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Roles whose buckets may donate a candidate when this role is short during rebalancing.
     */
    public List<Role> adjacentRoles() {
        return switch (this) {
            case DECISION -> List.of(CHAMPION);
            case CHAMPION -> List.of(DECISION, STAKEHOLDER, INTRODUCER);
            case STAKEHOLDER -> List.of(CHAMPION, BLOCKER, INTRODUCER);
            case BLOCKER -> List.of(STAKEHOLDER);
            case INTRODUCER -> List.of(STAKEHOLDER, CHAMPION);
        };
    }

    /**
     * Lenient lookup used by YAML keys and CLI input ("decision", "Decision", "DECISION").
     */
    public static Role fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Role key must not be blank");
        }
        String normalized = key.trim().toUpperCase().replace('-', '_');
        if (normalized.equals("DECISION_MAKER")) {
            return DECISION;
        }
        return Role.valueOf(normalized);
    }
}
