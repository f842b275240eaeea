package com.flagship.point_ledger.ledger;

import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One successful spend (or admin deduction) and the exact grants it drew from.
 *
 * consumedFrom is the single source of truth for rollback. It is written in the same
 * atomic batch as the grant decrements and never changes afterwards.
 *
 * Key invariant: totalAmount equals the sum of consumedFrom draws.
 */
@Value
public class UsageRecord {
    UUID id;
    UUID userId;
    UUID reservationId;
    long totalAmount;
    UsageStatus status;
    List<ConsumedDraw> consumedFrom;
    UUID spendEntryId;
    String rollbackReason;
    Instant createdAt;
    Instant rolledBackAt;
    @With
    long version;

    /**
     * Creates a COMMITTED usage record.
     *
     * @param reservationId the obligation being paid, null for admin deductions
     * @throws IllegalArgumentException if the draws are empty or do not add up to the total
     */
    public static UsageRecord commit(UUID id, UUID userId, UUID reservationId, List<ConsumedDraw> consumedFrom,
                                     UUID spendEntryId, Instant now) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(spendEntryId, "spendEntryId");
        if (consumedFrom == null || consumedFrom.isEmpty()) {
            throw new IllegalArgumentException("A usage record must draw from at least one grant");
        }
        long total = consumedFrom.stream().mapToLong(ConsumedDraw::getAmountDrawn).sum();
        return new UsageRecord(id, userId, reservationId, total, UsageStatus.COMMITTED,
            List.copyOf(consumedFrom), spendEntryId, null, now, null, 0L);
    }

    /**
     * Marks the record ROLLED_BACK.
     * Only valid from COMMITTED.
     *
     * @throws IllegalStateException if the record was already rolled back
     */
    public UsageRecord rollBack(String reason, Instant now) {
        if (status != UsageStatus.COMMITTED) {
            throw new IllegalStateException(
                String.format("Cannot roll back usage %s in %s status. Only COMMITTED usages can be rolled back.",
                    id, status));
        }
        return new UsageRecord(id, userId, reservationId, totalAmount, UsageStatus.ROLLED_BACK,
            consumedFrom, spendEntryId, reason, createdAt, now, version);
    }

    public boolean isCommitted() {
        return status == UsageStatus.COMMITTED;
    }
}
