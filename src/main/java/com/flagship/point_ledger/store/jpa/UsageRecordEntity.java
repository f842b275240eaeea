package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.UsageRecord;
import com.flagship.point_ledger.ledger.UsageStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA Entity for usage record persistence.
 *
 * The consumed-from draws live in their own table, in FIFO order, and are written once
 * together with the record. Only status and rollback columns change afterwards.
 */
@Entity
@Table(
    name = "usage_records",
    indexes = {
        @Index(name = "idx_usage_records_user", columnList = "user_id"),
        @Index(name = "idx_usage_records_reservation", columnList = "reservation_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UsageRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "reservation_id", updatable = false)
    private UUID reservationId;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private long totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UsageStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "usage_record_draws", joinColumns = @JoinColumn(name = "usage_record_id"))
    @OrderColumn(name = "draw_order")
    private List<ConsumedDrawEmbeddable> consumedFrom = new ArrayList<>();

    @Column(name = "spend_entry_id", nullable = false, updatable = false)
    private UUID spendEntryId;

    @Column(name = "rollback_reason", length = 500)
    private String rollbackReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "rolled_back_at")
    private Instant rolledBackAt;

    @Version
    @Column(nullable = false)
    private Long version;

    static UsageRecordEntity fromDomain(UsageRecord record) {
        List<ConsumedDrawEmbeddable> draws = new ArrayList<>();
        record.getConsumedFrom().forEach(draw -> draws.add(ConsumedDrawEmbeddable.fromDomain(draw)));
        return new UsageRecordEntity(
            record.getId(),
            record.getUserId(),
            record.getReservationId(),
            record.getTotalAmount(),
            record.getStatus(),
            draws,
            record.getSpendEntryId(),
            record.getRollbackReason(),
            record.getCreatedAt(),
            record.getRolledBackAt(),
            null
        );
    }

    public UsageRecord toDomain() {
        return new UsageRecord(
            id,
            userId,
            reservationId,
            totalAmount,
            status,
            consumedFrom.stream().map(ConsumedDrawEmbeddable::toDomain).toList(),
            spendEntryId,
            rollbackReason,
            createdAt,
            rolledBackAt,
            version
        );
    }
}
