package com.flagship.point_ledger.ledger.exception;

/**
 * Concurrent writers kept winning the compare-and-update race until the retry budget ran out.
 * Safe for the caller to retry.
 */
public class TransientFailureException extends PointLedgerException {

    public TransientFailureException(String operation, int attempts, Throwable cause) {
        super(LedgerErrorCode.TRANSIENT_FAILURE,
            String.format("%s gave up after %d attempts under concurrent modification", operation, attempts),
            cause);
    }
}
