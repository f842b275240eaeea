package com.flagship.point_ledger.ledger.exception;

/**
 * Non-positive spend amount, or an amount whose sign does not match the entry kind.
 * Raised before any mutation.
 */
public class InvalidAmountException extends PointLedgerException {

    public InvalidAmountException(String message) {
        super(LedgerErrorCode.INVALID_AMOUNT, message);
    }
}
