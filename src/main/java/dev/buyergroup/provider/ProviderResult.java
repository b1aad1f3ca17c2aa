package dev.buyergroup.provider;

/**
 * Typed outcome of one logical provider call.
 *
 * @param status         How the call ended
 * @param value          Payload for SUCCESS and CACHED, null otherwise
 * @param creditsCharged Credits charged to the ledger for this call
 * @param error          Failure description for SOFT_FAIL and HARD_FAIL
 */
public record ProviderResult<T>(Status status, T value, int creditsCharged, String error) {

    public enum Status {
        SUCCESS,
        CACHED,
        DRY_RUN,
        /** Provider answered but the record is unusable (404, unparseable). */
        SOFT_FAIL,
        /** Network, 5xx or timeout after the retry. */
        HARD_FAIL,
        /** Not issued: the call would exceed the budget. Nothing charged. */
        BUDGET_EXHAUSTED
    }

    public static <T> ProviderResult<T> success(T value, int credits) {
        return new ProviderResult<>(Status.SUCCESS, value, credits, null);
    }

    public static <T> ProviderResult<T> cached(T value) {
        return new ProviderResult<>(Status.CACHED, value, 0, null);
    }

    public static <T> ProviderResult<T> dryRun(int credits) {
        return new ProviderResult<>(Status.DRY_RUN, null, credits, null);
    }

    public static <T> ProviderResult<T> softFail(int credits, String error) {
        return new ProviderResult<>(Status.SOFT_FAIL, null, credits, error);
    }

    public static <T> ProviderResult<T> hardFail(int credits, String error) {
        return new ProviderResult<>(Status.HARD_FAIL, null, credits, error);
    }

    public static <T> ProviderResult<T> budgetExhausted() {
        return new ProviderResult<>(Status.BUDGET_EXHAUSTED, null, 0, null);
    }

    public boolean hasValue() {
        return status == Status.SUCCESS || status == Status.CACHED;
    }
}
