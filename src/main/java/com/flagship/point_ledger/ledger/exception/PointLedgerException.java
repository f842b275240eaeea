package com.flagship.point_ledger.ledger.exception;

import lombok.Getter;

/**
 * Base class of every failure the point ledger reports to its callers.
 */
@Getter
public abstract class PointLedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    protected PointLedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PointLedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    public String getUserMessage() {
        return errorCode.userMessage(getMessage());
    }
}
