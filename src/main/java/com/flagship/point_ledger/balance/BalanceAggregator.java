package com.flagship.point_ledger.balance;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.store.EntryOrder;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Derives balances from a snapshot of one user's entries.
 *
 * A pure function of its input: no store access, no clock. remainingAmount is already net of
 * every committed draw, so the available balance is the sum of what remains on spendable grants
 * and consumption is never subtracted a second time.
 */
public final class BalanceAggregator {

    private BalanceAggregator() {
    }

    public static BalanceSnapshot aggregate(UUID userId, Collection<LedgerEntry> entries, Instant now) {
        long totalEarned = 0;
        long totalUsed = 0;
        long available = 0;
        long pending = 0;
        long expired = 0;

        for (LedgerEntry entry : entries) {
            if (entry.isGrant()) {
                totalEarned += entry.getAmount();
                switch (entry.getStatus()) {
                    case PENDING -> pending += entry.getRemainingAmount();
                    case AVAILABLE -> {
                        // Past expiry but not swept yet: already lost to the user
                        if (entry.isExpiredAt(now)) {
                            expired += entry.getRemainingAmount();
                        } else {
                            available += entry.getRemainingAmount();
                        }
                    }
                    default -> {
                        // USED and EXPIRED grants hold nothing; their points are counted
                        // through spend and forfeiture entries
                    }
                }
            } else if (entry.getKind() == EntryKind.EXPIRED) {
                expired += -entry.getAmount();
            } else if (entry.isSpend() && entry.getStatus() == EntryStatus.USED) {
                totalUsed += -entry.getAmount();
            }
        }

        return new BalanceSnapshot(userId, now, totalEarned, totalUsed, available, pending, expired);
    }

    /**
     * Spendable grants in FIFO order with their remaining amounts.
     */
    public static FifoBreakdown fifoBreakdown(UUID userId, Collection<LedgerEntry> entries, Instant now) {
        List<FifoBreakdown.Item> items = entries.stream()
            .filter(e -> e.isSpendableAt(now))
            .sorted(EntryOrder.FIFO.comparator())
            .map(e -> new FifoBreakdown.Item(e.getId(), e.getKind(), e.getRemainingAmount(),
                e.getAvailableFrom(), e.getExpiresAt()))
            .toList();
        long total = items.stream().mapToLong(FifoBreakdown.Item::getRemainingAmount).sum();
        Instant oldest = items.isEmpty() ? null : items.get(0).getAvailableFrom();
        Instant newest = items.isEmpty() ? null : items.get(items.size() - 1).getAvailableFrom();
        return new FifoBreakdown(userId, now, items, total, oldest, newest);
    }
}
