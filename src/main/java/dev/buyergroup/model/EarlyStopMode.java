package dev.buyergroup.model;

/**
 * Controls whether the orchestrator may skip planned collects once role targets are met.
 */
public enum EarlyStopMode {
    /** Never stop early; spend the whole collect plan. */
    ACCURACY_FIRST,
    /** Stop once minimum targets are met and there are enough candidates to fill the group. */
    BALANCED,
    /** Stop as soon as every minimum role target is met. */
    COST_FIRST;

    public static EarlyStopMode fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ACCURACY_FIRST;
        }
        return EarlyStopMode.valueOf(key.trim().toUpperCase().replace('-', '_'));
    }
}
