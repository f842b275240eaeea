package com.flagship.point_ledger.ledger.exception;

/**
 * Error taxonomy of the point ledger.
 *
 * Business-rule failures are reported to callers as-is. Everything else is logged with
 * full context and surfaced as an opaque "try again" so internal state does not leak.
 */
public enum LedgerErrorCode {
    INVALID_AMOUNT(true, false),
    INSUFFICIENT_FUNDS(true, false),
    TRANSIENT_FAILURE(false, true),
    ALREADY_ROLLED_BACK_OR_MISSING(true, false),
    PARTIAL_STATE_CORRUPTION(false, false);

    private static final String OPAQUE_MESSAGE = "The point ledger could not complete the request. Please try again.";

    private final boolean businessRule;
    private final boolean retryable;

    LedgerErrorCode(boolean businessRule, boolean retryable) {
        this.businessRule = businessRule;
        this.retryable = retryable;
    }

    public boolean isBusinessRule() {
        return businessRule;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Text safe to show a caller for an exception carrying this code.
     */
    public String userMessage(String detail) {
        return businessRule ? detail : OPAQUE_MESSAGE;
    }
}
