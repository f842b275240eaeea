package com.flagship.point_ledger.balance;

import com.flagship.point_ledger.ledger.EntryKind;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The grants a spend would draw from right now, in the order it would draw them.
 */
@Value
public class FifoBreakdown {
    UUID userId;
    Instant asOf;
    List<Item> items;
    long totalAvailable;

    /**
     * Null when nothing is spendable.
     */
    Instant oldestAvailableFrom;
    Instant newestAvailableFrom;

    public int getCount() {
        return items.size();
    }

    @Value
    public static class Item {
        UUID entryId;
        EntryKind kind;
        long remainingAmount;
        Instant availableFrom;
        Instant expiresAt;
    }
}
