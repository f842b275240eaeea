package com.flagship.point_ledger.usage;

import com.flagship.point_ledger.ledger.ConsumedDraw;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import com.flagship.point_ledger.ledger.exception.AlreadyRolledBackOrMissingException;
import com.flagship.point_ledger.ledger.exception.PartialStateCorruptionException;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.OptimisticRetryExecutor;
import com.flagship.point_ledger.store.WriteBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Reverses a committed usage by giving each drawn amount back to the grant it came from.
 *
 * Restoration is additive on the grant as it is now, re-read on every attempt. A grant that
 * has expired in the meantime takes the points back and forfeits them at once, so rollback
 * never revives an expired credit. Every restoration, the spend entry cancellation and the
 * usage status flip are committed as one batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RollbackEngine {

    private final LedgerStore store;
    private final OptimisticRetryExecutor retryExecutor;
    private final Clock clock;

    /**
     * @return the usage record in ROLLED_BACK status
     * @throws IllegalArgumentException if reason is blank
     * @throws AlreadyRolledBackOrMissingException if the record is unknown or not COMMITTED
     * @throws PartialStateCorruptionException if a referenced entry is gone or cannot take its points back
     */
    public UsageRecord rollback(UUID usageRecordId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A rollback reason is required");
        }
        return retryExecutor.execute("rollback", () -> attempt(usageRecordId, reason));
    }

    private UsageRecord attempt(UUID usageRecordId, String reason) {
        Instant now = clock.instant();
        UsageRecord usage = store.getUsageRecord(usageRecordId)
            .filter(UsageRecord::isCommitted)
            .orElseThrow(() -> new AlreadyRolledBackOrMissingException(usageRecordId));

        // A grant appears once per batch even if the usage drew on it more than once
        Map<UUID, Long> drawnPerGrant = new LinkedHashMap<>();
        for (ConsumedDraw draw : usage.getConsumedFrom()) {
            drawnPerGrant.merge(draw.getGrantEntryId(), draw.getAmountDrawn(), Long::sum);
        }

        WriteBatch batch = new WriteBatch();
        for (Map.Entry<UUID, Long> drawn : drawnPerGrant.entrySet()) {
            LedgerEntry grant = store.getEntry(drawn.getKey())
                .orElseThrow(() -> new PartialStateCorruptionException(usageRecordId, drawn.getKey(),
                    "grant entry no longer exists"));
            restore(usage, grant, drawn.getValue(), now, batch);
        }

        LedgerEntry spendEntry = store.getEntry(usage.getSpendEntryId())
            .orElseThrow(() -> new PartialStateCorruptionException(usageRecordId, usage.getSpendEntryId(),
                "spend entry no longer exists"));
        if (!spendEntry.isSpend() || spendEntry.getStatus() != EntryStatus.USED) {
            throw new PartialStateCorruptionException(usageRecordId, spendEntry.getId(),
                "spend entry is " + spendEntry.getStatus());
        }
        batch.updateEntry(spendEntry, spendEntry.cancel(now));

        UsageRecord rolledBack = usage.rollBack(reason, now);
        batch.updateUsage(usage, rolledBack);

        store.atomicWrite(batch);
        return rolledBack.withVersion(usage.getVersion() + 1);
    }

    private void restore(UsageRecord usage, LedgerEntry grant, long drawn, Instant now, WriteBatch batch) {
        if (!grant.isGrant()) {
            throw new PartialStateCorruptionException(usage.getId(), grant.getId(), "entry is not a grant");
        }
        EntryStatus status = grant.getStatus();
        if (status == EntryStatus.PENDING || status == EntryStatus.CANCELLED) {
            throw new PartialStateCorruptionException(usage.getId(), grant.getId(),
                "grant is " + status + " and was never drawable");
        }

        if (status == EntryStatus.EXPIRED || grant.isExpiredAt(now)) {
            long forfeited = drawn;
            if (status != EntryStatus.EXPIRED) {
                forfeited += grant.getRemainingAmount();
                batch.updateEntry(grant, grant.markExpired(now));
            }
            batch.insertEntry(LedgerEntry.forfeiture(UUID.randomUUID(), grant, forfeited, now));
            log.info("Restored points forfeited to expiry: usageRecordId={}, grantId={}, forfeited={}",
                usage.getId(), grant.getId(), forfeited);
            return;
        }

        if (grant.getRemainingAmount() + drawn > grant.getAmount()) {
            throw new PartialStateCorruptionException(usage.getId(), grant.getId(),
                String.format("restoring %d would exceed the grant (remaining=%d, amount=%d)",
                    drawn, grant.getRemainingAmount(), grant.getAmount()));
        }
        batch.updateEntry(grant, grant.restore(drawn, now));
    }
}
