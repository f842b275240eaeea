package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for ledger entry persistence.
 *
 * Key design principles:
 * - No @Setter: mutable columns change only through the conditional update in
 *   {@link LedgerEntryRepository#compareAndUpdate}
 * - Identity, kind, amount and timestamps of creation are updatable = false
 * - Controlled factory: fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "ledger_entries",
    indexes = {
        @Index(name = "idx_ledger_entries_user_status", columnList = "user_id, status"),
        @Index(name = "idx_ledger_entries_status_available_from", columnList = "status, available_from"),
        @Index(name = "idx_ledger_entries_status_expires_at", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EntryKind kind;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EntryStatus status;

    @Column(name = "available_from", updatable = false)
    private Instant availableFrom;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "remaining_amount", nullable = false)
    private long remainingAmount;

    @Column(name = "linked_usage_id", updatable = false)
    private UUID linkedUsageId;

    @Column(name = "related_entry_id", updatable = false)
    private UUID relatedEntryId;

    @Column(name = "reservation_id", updatable = false)
    private UUID reservationId;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Null until first persisted; Hibernate then starts it at 0.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        return new LedgerEntryEntity(
            entry.getId(),
            entry.getUserId(),
            entry.getKind(),
            entry.getAmount(),
            entry.getStatus(),
            entry.getAvailableFrom(),
            entry.getExpiresAt(),
            entry.getRemainingAmount(),
            entry.getLinkedUsageId(),
            entry.getRelatedEntryId(),
            entry.getReservationId(),
            entry.getDescription(),
            entry.getCreatedAt(),
            entry.getUpdatedAt(),
            null // version - assigned on insert
        );
    }

    public LedgerEntry toDomain() {
        return new LedgerEntry(
            id,
            userId,
            kind,
            amount,
            status,
            availableFrom,
            expiresAt,
            remainingAmount,
            linkedUsageId,
            relatedEntryId,
            reservationId,
            description,
            createdAt,
            updatedAt,
            version
        );
    }
}
