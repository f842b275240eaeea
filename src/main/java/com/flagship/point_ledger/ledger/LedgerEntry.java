package com.flagship.point_ledger.ledger;

import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Domain model for a point ledger entry: one grant of points or one spend of points.
 *
 * Key principles:
 * - The amount's sign must match the kind (see {@link EntryKind#allowsAmount(long)})
 * - Status transitions are explicit and validated
 * - State changes are immutable (each transition returns a new LedgerEntry)
 *
 * For grants, remainingAmount starts equal to amount and only FIFO draws lower it.
 * For spend and forfeiture entries remainingAmount is always zero.
 * The version is owned by the store and is used for compare-and-update.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID userId;
    EntryKind kind;
    long amount;
    EntryStatus status;
    Instant availableFrom;
    Instant expiresAt;
    long remainingAmount;
    UUID linkedUsageId;
    UUID relatedEntryId;
    UUID reservationId;
    String description;
    Instant createdAt;
    Instant updatedAt;
    @With
    long version;

    /**
     * Creates a grant entry (positive amount).
     *
     * @param status PENDING for held credits, AVAILABLE for credits usable immediately
     * @throws IllegalArgumentException if the amount is not positive or the kind cannot grant
     */
    public static LedgerEntry grant(UUID id, UUID userId, EntryKind kind, long amount, EntryStatus status,
                                    Instant availableFrom, Instant expiresAt, UUID reservationId,
                                    String description, Instant now) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(availableFrom, "availableFrom");
        if (kind.isEngineRecorded() || amount <= 0 || !kind.allowsAmount(amount)) {
            throw new IllegalArgumentException(
                String.format("A %s grant cannot carry amount %d", kind, amount));
        }
        if (status != EntryStatus.PENDING && status != EntryStatus.AVAILABLE) {
            throw new IllegalArgumentException("A new grant must be PENDING or AVAILABLE, not " + status);
        }
        return new LedgerEntry(id, userId, kind, amount, status, availableFrom, expiresAt, amount,
            null, null, reservationId, description, now, now, 0L);
    }

    /**
     * Creates the spend entry written alongside a committed usage record.
     *
     * @param total positive number of points consumed; stored negated
     */
    public static LedgerEntry spend(UUID id, UUID userId, EntryKind kind, long total, UUID usageId,
                                    UUID reservationId, String description, Instant now) {
        Objects.requireNonNull(usageId, "usageId");
        if (kind != EntryKind.USED_SERVICE && kind != EntryKind.ADJUSTED_BY_ADMIN) {
            throw new IllegalArgumentException("Spend entries must be USED_SERVICE or ADJUSTED_BY_ADMIN, not " + kind);
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Spent total must be positive");
        }
        return new LedgerEntry(id, userId, kind, -total, EntryStatus.USED, null, null, 0L,
            usageId, null, reservationId, description, now, now, 0L);
    }

    /**
     * Creates the companion EXPIRED entry recording a remainder forfeited from a grant.
     */
    public static LedgerEntry forfeiture(UUID id, LedgerEntry grant, long forfeited, Instant now) {
        if (!grant.isGrant()) {
            throw new IllegalArgumentException("Only grants can forfeit points: " + grant.getId());
        }
        if (forfeited <= 0) {
            throw new IllegalArgumentException("Forfeited amount must be positive");
        }
        return new LedgerEntry(id, grant.getUserId(), EntryKind.EXPIRED, -forfeited, EntryStatus.EXPIRED,
            null, null, 0L, null, grant.getId(), null,
            String.format("Expired remainder of grant %s", grant.getId()), now, now, 0L);
    }

    public boolean isGrant() {
        return amount > 0;
    }

    public boolean isSpend() {
        return amount < 0 && kind != EntryKind.EXPIRED;
    }

    /**
     * True once the calendar has reached the entry's expiry. Entries without expiry never expire.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * True if FIFO consumption may draw on this entry at the given instant.
     */
    public boolean isSpendableAt(Instant now) {
        return status == EntryStatus.AVAILABLE && remainingAmount > 0 && !isExpiredAt(now);
    }

    /**
     * Transitions a held grant to AVAILABLE.
     * Only valid from PENDING once availableFrom has passed.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public LedgerEntry mature(Instant now) {
        if (status != EntryStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot mature entry %s in %s status. Only PENDING entries can mature.", id, status));
        }
        if (availableFrom.isAfter(now)) {
            throw new IllegalStateException(
                String.format("Entry %s is held until %s", id, availableFrom));
        }
        return transition(EntryStatus.AVAILABLE, remainingAmount, now);
    }

    /**
     * Draws points from an AVAILABLE grant. The grant becomes USED when nothing remains.
     *
     * @throws IllegalStateException if the entry is not spendable or holds less than requested
     */
    public LedgerEntry draw(long drawn, Instant now) {
        if (!isSpendableAt(now)) {
            throw new IllegalStateException(
                String.format("Cannot draw from entry %s in %s status (remaining=%d, expiresAt=%s)",
                    id, status, remainingAmount, expiresAt));
        }
        if (drawn <= 0 || drawn > remainingAmount) {
            throw new IllegalStateException(
                String.format("Cannot draw %d from entry %s holding %d", drawn, id, remainingAmount));
        }
        long left = remainingAmount - drawn;
        return transition(left == 0 ? EntryStatus.USED : EntryStatus.AVAILABLE, left, now);
    }

    /**
     * Gives back points previously drawn from this grant. A USED grant becomes AVAILABLE again.
     *
     * @throws IllegalStateException if the entry is not a drawable grant or would exceed its original amount
     */
    public LedgerEntry restore(long restored, Instant now) {
        if (!isGrant() || (status != EntryStatus.AVAILABLE && status != EntryStatus.USED)) {
            throw new IllegalStateException(
                String.format("Cannot restore points to entry %s in %s status", id, status));
        }
        if (restored <= 0 || remainingAmount + restored > amount) {
            throw new IllegalStateException(
                String.format("Restoring %d to entry %s would exceed its amount (remaining=%d, amount=%d)",
                    restored, id, remainingAmount, amount));
        }
        return transition(EntryStatus.AVAILABLE, remainingAmount + restored, now);
    }

    /**
     * Closes a grant as EXPIRED with nothing remaining.
     * The caller records the forfeited remainder as a companion entry.
     *
     * @throws IllegalStateException if the entry is not a grant past PENDING
     */
    public LedgerEntry markExpired(Instant now) {
        if (!isGrant() || status == EntryStatus.PENDING || status == EntryStatus.CANCELLED) {
            throw new IllegalStateException(
                String.format("Cannot expire entry %s in %s status", id, status));
        }
        return transition(EntryStatus.EXPIRED, 0L, now);
    }

    /**
     * Cancels a spend entry whose usage was rolled back.
     *
     * @throws IllegalStateException if the entry is not a USED spend entry
     */
    public LedgerEntry cancel(Instant now) {
        if (!isSpend() || status != EntryStatus.USED) {
            throw new IllegalStateException(
                String.format("Cannot cancel entry %s of kind %s in %s status", id, kind, status));
        }
        return transition(EntryStatus.CANCELLED, remainingAmount, now);
    }

    private LedgerEntry transition(EntryStatus newStatus, long newRemaining, Instant now) {
        return new LedgerEntry(
            this.id,
            this.userId,
            this.kind,
            this.amount,
            newStatus,
            this.availableFrom,
            this.expiresAt,
            newRemaining,
            this.linkedUsageId,
            this.relatedEntryId,
            this.reservationId,
            this.description,
            this.createdAt,
            now,
            this.version
        );
    }
}
