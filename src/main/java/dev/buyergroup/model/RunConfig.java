package dev.buyergroup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-invocation settings for one pipeline run. Budgets are expressed in provider credits.
 */
@Value
@Builder(toBuilder = true)
public class RunConfig {

    @Builder.Default
    int searchBudget = 20;

    @Builder.Default
    int collectBudget = 200;

    /** 0 means use the seller profile's maximum. */
    int maxGroupSize;

    @Builder.Default
    EarlyStopMode earlyStopMode = EarlyStopMode.ACCURACY_FIRST;

    boolean dryRun;

    /** Extra aliases for this target company, merged with the profile's aliases. */
    @Singular("companyAlias")
    List<String> companyAliases;

    /** 0 means use the engine default. */
    int maxQueries;

    /** No new provider calls are issued after this instant. Null means no deadline. */
    Instant deadline;
}
