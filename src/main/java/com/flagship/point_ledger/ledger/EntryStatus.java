package com.flagship.point_ledger.ledger;

/**
 * Lifecycle status of a ledger entry.
 *
 * Grant entries move PENDING -> AVAILABLE -> USED / EXPIRED.
 * Rollback may move a USED grant back to AVAILABLE while it is still within its validity window.
 * Spend entries are written as USED and become CANCELLED when their usage is rolled back.
 */
public enum EntryStatus {
    /**
     * Grant inside its holding period. Not spendable.
     */
    PENDING,

    /**
     * Grant that can be drawn on by FIFO consumption.
     */
    AVAILABLE,

    /**
     * Grant fully consumed, or a spend entry.
     */
    USED,

    /**
     * Grant past its expiry, or the companion entry recording the forfeited remainder.
     * Terminal.
     */
    EXPIRED,

    /**
     * Spend entry whose usage was rolled back.
     * Terminal.
     */
    CANCELLED
}
