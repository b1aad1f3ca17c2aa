package dev.buyergroup.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running credit counters shared by all provider workers of one pipeline run.
 * Counters only grow. Budgeted charges use compare-and-set so concurrent workers
 * can never push a counter past its budget.
 */
public class CreditLedger {

    private final AtomicInteger searchCredits = new AtomicInteger();
    private final AtomicInteger collectCredits = new AtomicInteger();
    private final AtomicInteger searchCalls = new AtomicInteger();
    private final AtomicInteger collectCalls = new AtomicInteger();

    /**
     * Charge a search call if it still fits in the budget.
     *
     * @return true if the credits were charged and the call may be issued
     */
    public boolean tryChargeSearch(int cost, int budget) {
        if (!tryCharge(searchCredits, cost, budget)) {
            return false;
        }
        searchCalls.incrementAndGet();
        return true;
    }

    /**
     * Charge a collect call if it still fits in the budget.
     *
     * @return true if the credits were charged and the call may be issued
     */
    public boolean tryChargeCollect(int cost, int budget) {
        if (!tryCharge(collectCredits, cost, budget)) {
            return false;
        }
        collectCalls.incrementAndGet();
        return true;
    }

    private boolean tryCharge(AtomicInteger counter, int cost, int budget) {
        if (cost < 0) {
            throw new IllegalArgumentException("Credit cost must not be negative: " + cost);
        }
        while (true) {
            int current = counter.get();
            if ((long) current + cost > budget) {
                return false;
            }
            if (counter.compareAndSet(current, current + cost)) {
                return true;
            }
        }
    }

    public int getSearchCredits() {
        return searchCredits.get();
    }

    public int getCollectCredits() {
        return collectCredits.get();
    }

    public int getSearchCalls() {
        return searchCalls.get();
    }

    public int getCollectCalls() {
        return collectCalls.get();
    }

    public int getTotalCredits() {
        return getSearchCredits() + getCollectCredits();
    }

    public CreditsUsed snapshot(double usdPerCredit) {
        int search = getSearchCredits();
        int collect = getCollectCredits();
        return new CreditsUsed(search, collect, search + collect, (search + collect) * usdPerCredit);
    }

    /**
     * Immutable view of the ledger handed out in reports.
     */
    public record CreditsUsed(int search, int collect, int total, double estimatedCostUsd) {
    }
}
