package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory ledger store.
 *
 * Every read runs under the read lock and every batch is validated and applied under the
 * write lock, so readers never observe part of a batch.
 */
@Repository
@ConditionalOnProperty(name = "point-ledger.store", havingValue = "memory")
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<UUID, LedgerEntry> entries = new HashMap<>();
    private final Map<UUID, UsageRecord> usageRecords = new HashMap<>();
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public List<LedgerEntry> findByUser(UUID userId, EntryStatus statusFilter, EntryOrder order) {
        return read(() -> entries.values().stream()
            .filter(e -> e.getUserId().equals(userId))
            .filter(e -> statusFilter == null || e.getStatus() == statusFilter)
            .sorted(order.comparator())
            .toList());
    }

    @Override
    public Optional<LedgerEntry> getEntry(UUID entryId) {
        return read(() -> Optional.ofNullable(entries.get(entryId)));
    }

    @Override
    public Optional<UsageRecord> getUsageRecord(UUID usageRecordId) {
        return read(() -> Optional.ofNullable(usageRecords.get(usageRecordId)));
    }

    @Override
    public List<LedgerEntry> findDueForMaturation(Instant now) {
        return read(() -> entries.values().stream()
            .filter(e -> e.getStatus() == EntryStatus.PENDING)
            .filter(e -> !e.getAvailableFrom().isAfter(now))
            .sorted(EntryOrder.FIFO.comparator())
            .toList());
    }

    @Override
    public List<LedgerEntry> findDueForExpiration(Instant now) {
        return read(() -> entries.values().stream()
            .filter(e -> e.getStatus() == EntryStatus.AVAILABLE)
            .filter(e -> e.getRemainingAmount() > 0)
            .filter(e -> e.isExpiredAt(now))
            .sorted(EntryOrder.FIFO.comparator())
            .toList());
    }

    @Override
    public Page<LedgerEntry> findHistory(UUID userId, HistoryFilter filter, Pageable pageable) {
        List<LedgerEntry> matching = findByUser(userId, null, EntryOrder.NEWEST_FIRST).stream()
            .filter(filter::matches)
            .toList();
        if (pageable.isUnpaged()) {
            return new PageImpl<>(matching);
        }
        int from = (int) Math.min(pageable.getOffset(), matching.size());
        int to = Math.min(from + pageable.getPageSize(), matching.size());
        return new PageImpl<>(matching.subList(from, to), pageable, matching.size());
    }

    @Override
    public void atomicWrite(WriteBatch batch) {
        Lock writeLock = rwLock.writeLock();
        writeLock.lock();
        try {
            validate(batch);
            apply(batch);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Number of stored entries, for tests and diagnostics.
     */
    public int entryCount() {
        return read(entries::size);
    }

    private <T> T read(Supplier<T> query) {
        Lock readLock = rwLock.readLock();
        readLock.lock();
        try {
            return query.get();
        } finally {
            readLock.unlock();
        }
    }

    // Checks the whole batch before touching anything
    private void validate(WriteBatch batch) {
        Set<UUID> touched = new HashSet<>();
        for (WriteBatch.Write<LedgerEntry> write : batch.getEntryWrites()) {
            UUID id = write.getNewState().getId();
            if (!touched.add(id)) {
                throw new IllegalArgumentException("Entry " + id + " written twice in one batch");
            }
            checkVersion("LedgerEntry", id, write.getExpectedVersion(),
                Optional.ofNullable(entries.get(id)).map(LedgerEntry::getVersion));
        }
        for (WriteBatch.Write<UsageRecord> write : batch.getUsageWrites()) {
            UUID id = write.getNewState().getId();
            if (!touched.add(id)) {
                throw new IllegalArgumentException("Usage record " + id + " written twice in one batch");
            }
            checkVersion("UsageRecord", id, write.getExpectedVersion(),
                Optional.ofNullable(usageRecords.get(id)).map(UsageRecord::getVersion));
        }
    }

    private void apply(WriteBatch batch) {
        for (WriteBatch.Write<LedgerEntry> write : batch.getEntryWrites()) {
            LedgerEntry state = write.getNewState();
            entries.put(state.getId(), state.withVersion(nextVersion(write.getExpectedVersion())));
        }
        for (WriteBatch.Write<UsageRecord> write : batch.getUsageWrites()) {
            UsageRecord state = write.getNewState();
            usageRecords.put(state.getId(), state.withVersion(nextVersion(write.getExpectedVersion())));
        }
        log.debug("Applied batch: entries={}, usageRecords={}",
            batch.getEntryWrites().size(), batch.getUsageWrites().size());
    }

    private void checkVersion(String entity, UUID id, Long expectedVersion, Optional<Long> currentVersion) {
        if (expectedVersion == null) {
            if (currentVersion.isPresent()) {
                throw new IllegalStateException(entity + " " + id + " already exists");
            }
            return;
        }
        if (currentVersion.isEmpty() || !currentVersion.get().equals(expectedVersion)) {
            throw new VersionConflictException(entity, id, expectedVersion);
        }
    }

    private static long nextVersion(Long expectedVersion) {
        return expectedVersion == null ? 0L : expectedVersion + 1;
    }
}
