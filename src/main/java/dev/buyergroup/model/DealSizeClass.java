package dev.buyergroup.model;

/**
 * Deal size bands. Each band carries the minimum seniority a Decision member
 * needs to carry budget authority for a deal of that size.
 */
public enum DealSizeClass {
    SMALL(0, SeniorityLevel.MANAGER),
    MEDIUM(50_000, SeniorityLevel.DIRECTOR),
    LARGE(200_000, SeniorityLevel.VP),
    ENTERPRISE(1_000_000, SeniorityLevel.SVP);

    private final long minimumDealUsd;
    private final SeniorityLevel authorityLevel;

    DealSizeClass(long minimumDealUsd, SeniorityLevel authorityLevel) {
        this.minimumDealUsd = minimumDealUsd;
        this.authorityLevel = authorityLevel;
    }

    public long getMinimumDealUsd() {
        return minimumDealUsd;
    }

    public SeniorityLevel getAuthorityLevel() {
        return authorityLevel;
    }

    public static DealSizeClass forDealSize(long dealUsd) {
        DealSizeClass result = SMALL;
        for (DealSizeClass candidate : values()) {
            if (dealUsd >= candidate.minimumDealUsd) {
                result = candidate;
            }
        }
        return result;
    }
}
