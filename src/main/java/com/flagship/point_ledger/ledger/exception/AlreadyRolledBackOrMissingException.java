package com.flagship.point_ledger.ledger.exception;

import java.util.UUID;

/**
 * Rollback of a usage record that does not exist or is no longer COMMITTED. Not retryable.
 */
public class AlreadyRolledBackOrMissingException extends PointLedgerException {

    public AlreadyRolledBackOrMissingException(UUID usageRecordId) {
        super(LedgerErrorCode.ALREADY_ROLLED_BACK_OR_MISSING,
            "Usage record " + usageRecordId + " does not exist or was already rolled back");
    }
}
