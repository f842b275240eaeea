package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.UsageStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecordEntity, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UsageRecordEntity u SET u.status = :status, u.rollbackReason = :reason, " +
           "u.rolledBackAt = :rolledBackAt, u.version = u.version + 1 " +
           "WHERE u.id = :id AND u.version = :expectedVersion")
    int compareAndUpdate(@Param("id") UUID id,
                         @Param("expectedVersion") long expectedVersion,
                         @Param("status") UsageStatus status,
                         @Param("reason") String reason,
                         @Param("rolledBackAt") Instant rolledBackAt);
}
