package dev.buyergroup.metrics;

import dev.buyergroup.model.PipelineState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for buyer group pipeline runs and provider traffic.
 */
@Component
public class EngineMetrics {

    private static final String TAG_OPERATION = "operation";
    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    // Counters
    private final Counter candidatesFoundCounter;
    private final Counter profilesCollectedCounter;
    private final Counter profilesExcludedCounter;
    private final Counter profilesQualifiedCounter;
    private final Counter membersSelectedCounter;

    // Timers (per provider operation)
    private final ConcurrentHashMap<String, Timer> operationTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunCandidates = new AtomicInteger(0);
    private final AtomicInteger lastRunMembers = new AtomicInteger(0);
    private final AtomicInteger lastRunCredits = new AtomicInteger(0);

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.candidatesFoundCounter = Counter.builder("buyer_group_candidates_found_total")
                .description("Distinct candidate ids returned by provider searches")
                .register(registry);

        this.profilesCollectedCounter = Counter.builder("buyer_group_profiles_collected_total")
                .description("Full profiles collected from the provider")
                .register(registry);

        this.profilesExcludedCounter = Counter.builder("buyer_group_profiles_excluded_total")
                .description("Collected profiles rejected by the quality filters")
                .register(registry);

        this.profilesQualifiedCounter = Counter.builder("buyer_group_profiles_qualified_total")
                .description("Collected profiles that passed the quality filters")
                .register(registry);

        this.membersSelectedCounter = Counter.builder("buyer_group_members_selected_total")
                .description("Members placed into final buyer groups")
                .register(registry);

        Gauge.builder("buyer_group_last_run_candidates", lastRunCandidates, AtomicInteger::get)
                .description("Candidates found in last run")
                .register(registry);

        Gauge.builder("buyer_group_last_run_members", lastRunMembers, AtomicInteger::get)
                .description("Buyer group size in last run")
                .register(registry);

        Gauge.builder("buyer_group_last_run_credits", lastRunCredits, AtomicInteger::get)
                .description("Provider credits used in last run")
                .register(registry);
    }

    /**
     * Get or create the latency timer for a provider operation ("search" or "collect").
     */
    public Timer getOperationTimer(String operation) {
        return operationTimers.computeIfAbsent(operation, name ->
                Timer.builder("buyer_group_provider_call_duration")
                        .description("Latency of provider calls")
                        .tag(TAG_OPERATION, name)
                        .register(registry)
        );
    }

    public void recordCallLatency(String operation, long latencyMs) {
        getOperationTimer(operation).record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record the outcome of one logical provider call.
     */
    public void recordProviderCall(String operation, String status) {
        Counter.builder("buyer_group_provider_calls_total")
                .tag(TAG_OPERATION, operation)
                .tag(TAG_STATUS, status.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordCreditsCharged(String operation, int credits) {
        if (credits <= 0) {
            return;
        }
        Counter.builder("buyer_group_credits_charged_total")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment(credits);
    }

    public void recordCandidatesFound(int count) {
        candidatesFoundCounter.increment(count);
    }

    public void recordProfilesCollected(int count) {
        profilesCollectedCounter.increment(count);
    }

    public void recordProfilesExcluded(int count) {
        profilesExcludedCounter.increment(count);
    }

    public void recordProfilesQualified(int count) {
        profilesQualifiedCounter.increment(count);
    }

    public void recordMembersSelected(int count) {
        membersSelectedCounter.increment(count);
    }

    /**
     * Count a finished run by its terminal state.
     */
    public void recordRun(PipelineState state) {
        Counter.builder("buyer_group_runs_total")
                .tag("state", state.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void updateLastRunStats(int candidates, int members, int credits) {
        lastRunCandidates.set(candidates);
        lastRunMembers.set(members);
        lastRunCredits.set(credits);
    }
}
