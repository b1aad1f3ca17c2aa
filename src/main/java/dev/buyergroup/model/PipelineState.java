package dev.buyergroup.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Pipeline lifecycle. DONE and FAILED are terminal; FAILED is reachable from
 * every non-terminal state.
 */
public enum PipelineState {
    INIT,
    SEARCHING,
    COLLECTING,
    ANALYZING,
    CLASSIFYING,
    SELECTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public Set<PipelineState> allowedNext() {
        return switch (this) {
            case INIT -> EnumSet.of(SEARCHING, FAILED);
            case SEARCHING -> EnumSet.of(COLLECTING, DONE, FAILED);
            case COLLECTING -> EnumSet.of(ANALYZING, FAILED);
            case ANALYZING -> EnumSet.of(CLASSIFYING, FAILED);
            case CLASSIFYING -> EnumSet.of(SELECTING, FAILED);
            case SELECTING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(PipelineState.class);
        };
    }

    public boolean canTransitionTo(PipelineState next) {
        return allowedNext().contains(next);
    }
}
