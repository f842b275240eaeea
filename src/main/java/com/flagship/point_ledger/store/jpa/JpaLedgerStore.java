package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import com.flagship.point_ledger.store.EntryOrder;
import com.flagship.point_ledger.store.HistoryFilter;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.VersionConflictException;
import com.flagship.point_ledger.store.WriteBatch;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed ledger store.
 *
 * This service bridges the domain layer (LedgerEntry, UsageRecord) and the persistence layer.
 * A batch runs in one database transaction: inserts go through the repositories, updates through
 * conditional UPDATE statements that only match the expected version. A zero update count aborts
 * the transaction, so no write of a conflicting batch is ever committed.
 */
@Service
@ConditionalOnProperty(name = "point-ledger.store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final LedgerEntryRepository entryRepository;
    private final UsageRecordRepository usageRepository;

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> findByUser(UUID userId, EntryStatus statusFilter, EntryOrder order) {
        List<LedgerEntryEntity> rows = statusFilter == null
            ? entryRepository.findByUserId(userId)
            : entryRepository.findByUserIdAndStatus(userId, statusFilter);
        return rows.stream()
            .map(LedgerEntryEntity::toDomain)
            .sorted(order.comparator())
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> getEntry(UUID entryId) {
        return entryRepository.findById(entryId).map(LedgerEntryEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UsageRecord> getUsageRecord(UUID usageRecordId) {
        return usageRepository.findById(usageRecordId).map(UsageRecordEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> findDueForMaturation(Instant now) {
        return entryRepository.findByStatusAndAvailableFromLessThanEqual(EntryStatus.PENDING, now).stream()
            .map(LedgerEntryEntity::toDomain)
            .sorted(EntryOrder.FIFO.comparator())
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> findDueForExpiration(Instant now) {
        return entryRepository.findDueForExpiration(EntryStatus.AVAILABLE, now).stream()
            .map(LedgerEntryEntity::toDomain)
            .sorted(EntryOrder.FIFO.comparator())
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Page<LedgerEntry> findHistory(UUID userId, HistoryFilter filter, Pageable pageable) {
        Specification<LedgerEntryEntity> specification = historySpecification(userId, filter);
        if (pageable.isUnpaged()) {
            return new PageImpl<>(entryRepository.findAll(specification, NEWEST_FIRST).stream()
                .map(LedgerEntryEntity::toDomain)
                .toList());
        }
        PageRequest newestFirst = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), NEWEST_FIRST);
        return entryRepository.findAll(specification, newestFirst)
            .map(LedgerEntryEntity::toDomain);
    }

    @Override
    @Transactional
    public void atomicWrite(WriteBatch batch) {
        // Inserts first, so conditional updates in the same batch flush them together
        for (WriteBatch.Write<LedgerEntry> write : batch.getEntryWrites()) {
            if (write.isInsert()) {
                entryRepository.save(LedgerEntryEntity.fromDomain(write.getNewState()));
            }
        }
        for (WriteBatch.Write<UsageRecord> write : batch.getUsageWrites()) {
            if (write.isInsert()) {
                usageRepository.save(UsageRecordEntity.fromDomain(write.getNewState()));
            }
        }

        for (WriteBatch.Write<LedgerEntry> write : batch.getEntryWrites()) {
            if (write.isInsert()) {
                continue;
            }
            LedgerEntry state = write.getNewState();
            int updated = entryRepository.compareAndUpdate(state.getId(), write.getExpectedVersion(),
                state.getStatus(), state.getRemainingAmount(), state.getUpdatedAt());
            if (updated == 0) {
                throw new VersionConflictException("LedgerEntry", state.getId(), write.getExpectedVersion());
            }
        }
        for (WriteBatch.Write<UsageRecord> write : batch.getUsageWrites()) {
            if (write.isInsert()) {
                continue;
            }
            UsageRecord state = write.getNewState();
            int updated = usageRepository.compareAndUpdate(state.getId(), write.getExpectedVersion(),
                state.getStatus(), state.getRollbackReason(), state.getRolledBackAt());
            if (updated == 0) {
                throw new VersionConflictException("UsageRecord", state.getId(), write.getExpectedVersion());
            }
        }

        // Surface insert failures inside this transaction rather than at commit
        entryRepository.flush();
        log.debug("Committed batch of {} writes", batch.size());
    }

    private static Specification<LedgerEntryEntity> historySpecification(UUID userId, HistoryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("userId"), userId));
            if (filter.getKind() != null) {
                predicates.add(cb.equal(root.get("kind"), filter.getKind()));
            }
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), filter.getTo()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
