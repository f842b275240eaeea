package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered, queryable persistence of ledger entries and usage records.
 *
 * The engine only reads through these queries and only writes through {@link #atomicWrite(WriteBatch)},
 * so every mutation is a version-checked, all-or-nothing batch.
 */
public interface LedgerStore {

    /**
     * All entries of a user.
     *
     * @param statusFilter only entries in this status, or all when null
     */
    List<LedgerEntry> findByUser(UUID userId, EntryStatus statusFilter, EntryOrder order);

    Optional<LedgerEntry> getEntry(UUID entryId);

    Optional<UsageRecord> getUsageRecord(UUID usageRecordId);

    /**
     * PENDING entries whose holding period ended at or before {@code now}.
     */
    List<LedgerEntry> findDueForMaturation(Instant now);

    /**
     * AVAILABLE entries with points remaining whose expiry is at or before {@code now}.
     */
    List<LedgerEntry> findDueForExpiration(Instant now);

    /**
     * A page of a user's entries, newest first (createdAt, then id, descending).
     * The order is fixed; any sort carried by {@code pageable} is ignored. An unpaged
     * {@code pageable} returns every matching entry as one page.
     */
    Page<LedgerEntry> findHistory(UUID userId, HistoryFilter filter, Pageable pageable);

    /**
     * Applies every write in the batch or none of them.
     *
     * @throws VersionConflictException if any updated row is no longer at its expected version
     */
    void atomicWrite(WriteBatch batch);
}
