package com.flagship.point_ledger.ledger;

/**
 * Status of a usage record.
 *
 * COMMITTED -> ROLLED_BACK is the only transition, and ROLLED_BACK is terminal.
 */
public enum UsageStatus {
    COMMITTED,
    ROLLED_BACK
}
