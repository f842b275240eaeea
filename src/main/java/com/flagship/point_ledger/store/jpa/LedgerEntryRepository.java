package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.EntryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for ledger entry persistence.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID>,
        JpaSpecificationExecutor<LedgerEntryEntity> {

    List<LedgerEntryEntity> findByUserId(UUID userId);

    List<LedgerEntryEntity> findByUserIdAndStatus(UUID userId, EntryStatus status);

    List<LedgerEntryEntity> findByStatusAndAvailableFromLessThanEqual(EntryStatus status, Instant now);

    @Query("SELECT e FROM LedgerEntryEntity e WHERE e.status = :status AND e.remainingAmount > 0 " +
           "AND e.expiresAt IS NOT NULL AND e.expiresAt <= :now")
    List<LedgerEntryEntity> findDueForExpiration(@Param("status") EntryStatus status, @Param("now") Instant now);

    /**
     * Writes the mutable columns only if the row is still at the expected version.
     *
     * @return 1 if the row was updated, 0 if it moved on or does not exist
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LedgerEntryEntity e SET e.status = :status, e.remainingAmount = :remaining, " +
           "e.updatedAt = :updatedAt, e.version = e.version + 1 " +
           "WHERE e.id = :id AND e.version = :expectedVersion")
    int compareAndUpdate(@Param("id") UUID id,
                         @Param("expectedVersion") long expectedVersion,
                         @Param("status") EntryStatus status,
                         @Param("remaining") long remaining,
                         @Param("updatedAt") Instant updatedAt);
}
