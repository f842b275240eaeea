package com.flagship.point_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Integrity alert: a usage record references a ledger entry that is gone or cannot take the
 * restoration. Requires a manual audit; the rollback was not applied.
 */
@Getter
public class PartialStateCorruptionException extends PointLedgerException {

    private final UUID usageRecordId;
    private final UUID entryId;

    public PartialStateCorruptionException(UUID usageRecordId, UUID entryId, String detail) {
        super(LedgerErrorCode.PARTIAL_STATE_CORRUPTION,
            String.format("Usage record %s cannot be rolled back through entry %s: %s",
                usageRecordId, entryId, detail));
        this.usageRecordId = usageRecordId;
        this.entryId = entryId;
    }
}
