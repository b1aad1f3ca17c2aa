package dev.buyergroup.service;

import dev.buyergroup.model.CreditLedger;
import dev.buyergroup.model.PipelineState;
import dev.buyergroup.model.ReportWarning;
import dev.buyergroup.model.RunConfig;
import dev.buyergroup.model.SellerProfile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one pipeline run: lifecycle state, credit ledger, counters and warnings.
 * State changes are validated against {@link PipelineState#allowedNext()}.
 */
@Slf4j
@Getter
public class PipelineRun {

    private final String companyName;
    private final SellerProfile sellerProfile;
    private final RunConfig runConfig;
    private final ScoringStrategy strategy;
    private final int maxGroupSize;
    private final CreditLedger ledger = new CreditLedger();
    private final Clock clock;

    private volatile PipelineState state = PipelineState.INIT;
    private final List<String> warnings = new ArrayList<>();

    private int queriesIssued;
    private int candidatesFound;
    private int profilesCollected;
    private int profilesQualified;

    private final AtomicBoolean searchBudgetExhausted = new AtomicBoolean();
    private final AtomicBoolean collectBudgetExhausted = new AtomicBoolean();
    private final AtomicBoolean deadlineExceeded = new AtomicBoolean();

    public PipelineRun(String companyName, SellerProfile sellerProfile, RunConfig runConfig,
                       ScoringStrategy strategy, Clock clock) {
        this.companyName = companyName;
        this.sellerProfile = sellerProfile;
        this.runConfig = runConfig;
        this.strategy = strategy;
        this.clock = clock;
        this.maxGroupSize = runConfig.getMaxGroupSize() > 0
                ? runConfig.getMaxGroupSize()
                : sellerProfile.getMaxBuyerGroupSize();
    }

    /**
     * Move to the next state.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public synchronized void transitionTo(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
        }
        log.debug("{}: {} -> {}", companyName, state, next);
        state = next;
    }

    /**
     * Whether the run deadline has passed. The first positive answer records a DeadlineExceeded warning.
     */
    public boolean deadlinePassed() {
        if (runConfig.getDeadline() == null || clock.instant().isBefore(runConfig.getDeadline())) {
            return false;
        }
        if (deadlineExceeded.compareAndSet(false, true)) {
            warn(ReportWarning.DEADLINE_EXCEEDED, "deadline " + runConfig.getDeadline()
                    + " reached during " + state + ", no further provider calls issued");
        }
        return true;
    }

    public synchronized void warn(ReportWarning warning, String message) {
        String formatted = warning.format(message);
        log.warn("{}: {}", companyName, formatted);
        warnings.add(formatted);
    }

    public synchronized void addWarnings(List<String> formatted) {
        warnings.addAll(formatted);
    }

    public synchronized List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isDryRun() {
        return runConfig.isDryRun();
    }

    public void setQueriesIssued(int queriesIssued) {
        this.queriesIssued = queriesIssued;
    }

    public void setCandidatesFound(int candidatesFound) {
        this.candidatesFound = candidatesFound;
    }

    public void setProfilesCollected(int profilesCollected) {
        this.profilesCollected = profilesCollected;
    }

    public void setProfilesQualified(int profilesQualified) {
        this.profilesQualified = profilesQualified;
    }
}
