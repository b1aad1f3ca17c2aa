package dev.buyergroup.model;

/**
 * Degradation codes surfaced on a report. Each warning string is rendered as
 * {@code <code>: <message>} so downstream consumers can filter on the prefix.
 */
public enum ReportWarning {
    NO_CANDIDATES_FOUND("NoCandidatesFound"),
    BUDGET_EXHAUSTED("BudgetExhausted"),
    ROLE_GAP_UNFILLED("RoleGapUnfilled"),
    ROLE_BELOW_TARGET("RoleBelowTarget"),
    PROVIDER_UNAVAILABLE("ProviderUnavailable"),
    CANDIDATE_UNAVAILABLE("CandidateUnavailable"),
    DEADLINE_EXCEEDED("DeadlineExceeded"),
    EARLY_STOP("EarlyStop"),
    DRY_RUN("DryRun"),
    PIPELINE_FAILED("PipelineFailed");

    private final String code;

    ReportWarning(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public String format(String message) {
        return code + ": " + message;
    }

    public boolean matches(String warning) {
        return warning != null && warning.startsWith(code + ":");
    }
}
