package dev.buyergroup.service;

import dev.buyergroup.config.ScoringConfig;
import dev.buyergroup.model.EarlyStopMode;

/**
 * Weights and stopping policy for one run, composed from the scoring configuration and
 * the run's early-stop mode.
 */
public record ScoringStrategy(
        double seniorityWeight,
        double departmentWeight,
        double titleWeight,
        double tenureWeight,
        double authorityPenalty,
        int tenureCapMonths,
        double overrideStrength,
        double gatekeeperStrength,
        double fallbackStrength,
        EarlyStopMode earlyStopMode) {

    public static ScoringStrategy of(ScoringConfig config, EarlyStopMode earlyStopMode) {
        return new ScoringStrategy(
                config.getSeniorityWeight(),
                config.getDepartmentWeight(),
                config.getTitleWeight(),
                config.getTenureWeight(),
                config.getAuthorityPenalty(),
                Math.max(1, config.getTenureCapMonths()),
                config.getOverrideStrength(),
                config.getGatekeeperStrength(),
                config.getFallbackStrength(),
                earlyStopMode != null ? earlyStopMode : EarlyStopMode.ACCURACY_FIRST);
    }

    public static ScoringStrategy defaults() {
        return of(new ScoringConfig(), EarlyStopMode.ACCURACY_FIRST);
    }
}
