package dev.buyergroup.model;

/**
 * Ordered seniority scale derived from title text.
 */
public enum SeniorityLevel {
    IC,
    MANAGER,
    DIRECTOR,
    SENIOR_DIRECTOR,
    VP,
    SVP,
    C_LEVEL;

    public int rank() {
        return ordinal();
    }

    public static int maxRank() {
        return C_LEVEL.ordinal();
    }

    public boolean isAtLeast(SeniorityLevel other) {
        return ordinal() >= other.ordinal();
    }
}
