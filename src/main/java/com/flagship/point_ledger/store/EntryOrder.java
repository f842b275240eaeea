package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.LedgerEntry;

import java.time.Instant;
import java.util.Comparator;

/**
 * Orderings the ledger store supports for per-user entry scans.
 */
public enum EntryOrder {
    /**
     * Oldest availability first, then oldest creation. This is the FIFO consumption order.
     */
    FIFO(Comparator.comparing(LedgerEntry::getAvailableFrom, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(LedgerEntry::getCreatedAt)
        .thenComparing(LedgerEntry::getId)),

    /**
     * Most recently created first. Used for history listings.
     */
    NEWEST_FIRST(Comparator.comparing(LedgerEntry::getCreatedAt).reversed()
        .thenComparing(LedgerEntry::getId));

    private final Comparator<LedgerEntry> comparator;

    EntryOrder(Comparator<LedgerEntry> comparator) {
        this.comparator = comparator;
    }

    public Comparator<LedgerEntry> comparator() {
        return comparator;
    }
}
