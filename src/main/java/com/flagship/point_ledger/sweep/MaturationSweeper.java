package com.flagship.point_ledger.sweep;

import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.OptimisticRetryExecutor;
import com.flagship.point_ledger.store.WriteBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Batch passes that mature held grants and expire stale ones.
 *
 * Each entry is handled in its own version-checked batch, re-read before it is written.
 * An entry that is no longer due when re-read is skipped, which makes both passes idempotent.
 * Scheduling is the caller's concern.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaturationSweeper {

    private final LedgerStore store;
    private final OptimisticRetryExecutor retryExecutor;

    /**
     * Flips every PENDING grant whose holding period has ended to AVAILABLE.
     */
    public SweepReport maturePending(Instant now) {
        return sweep("maturation", now, store.findDueForMaturation(now), entryId -> matureOne(entryId, now));
    }

    /**
     * Closes every AVAILABLE grant past its expiry and records the forfeited remainder
     * as a companion EXPIRED entry.
     */
    public SweepReport expireAvailable(Instant now) {
        return sweep("expiration", now, store.findDueForExpiration(now), entryId -> expireOne(entryId, now));
    }

    private Optional<Long> matureOne(UUID entryId, Instant now) {
        return retryExecutor.execute("maturePending", () -> {
            Optional<LedgerEntry> current = store.getEntry(entryId)
                .filter(e -> e.getStatus() == EntryStatus.PENDING)
                .filter(e -> !e.getAvailableFrom().isAfter(now));
            if (current.isEmpty()) {
                return Optional.<Long>empty();
            }
            LedgerEntry entry = current.get();
            store.atomicWrite(new WriteBatch().updateEntry(entry, entry.mature(now)));
            return Optional.of(0L);
        });
    }

    private Optional<Long> expireOne(UUID entryId, Instant now) {
        return retryExecutor.execute("expireAvailable", () -> {
            Optional<LedgerEntry> current = store.getEntry(entryId)
                .filter(e -> e.getStatus() == EntryStatus.AVAILABLE)
                .filter(e -> e.getRemainingAmount() > 0)
                .filter(e -> e.isExpiredAt(now));
            if (current.isEmpty()) {
                return Optional.<Long>empty();
            }
            LedgerEntry entry = current.get();
            long forfeited = entry.getRemainingAmount();
            store.atomicWrite(new WriteBatch()
                .updateEntry(entry, entry.markExpired(now))
                .insertEntry(LedgerEntry.forfeiture(UUID.randomUUID(), entry, forfeited, now)));
            return Optional.of(forfeited);
        });
    }

    private SweepReport sweep(String name, Instant now, List<LedgerEntry> due,
                              Function<UUID, Optional<Long>> processOne) {
        int processed = 0;
        int skipped = 0;
        long forfeited = 0;
        List<SweepReport.SweepFailure> failures = new ArrayList<>();

        for (LedgerEntry entry : due) {
            try {
                Optional<Long> outcome = processOne.apply(entry.getId());
                if (outcome.isPresent()) {
                    processed++;
                    forfeited += outcome.get();
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Sweep failed for entry: sweep={}, entryId={}, userId={}, error={}",
                    name, entry.getId(), entry.getUserId(), e.getMessage());
                failures.add(new SweepReport.SweepFailure(entry.getId(), e.getMessage()));
            }
        }

        return new SweepReport(name, now, due.size(), processed, skipped, forfeited, List.copyOf(failures));
    }
}
