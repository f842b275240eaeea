package com.flagship.point_ledger.ledger;

import com.flagship.point_ledger.accrual.AccrualCalculator;
import com.flagship.point_ledger.accrual.GrantContext;
import com.flagship.point_ledger.balance.BalanceAggregator;
import com.flagship.point_ledger.balance.BalanceSnapshot;
import com.flagship.point_ledger.balance.FifoBreakdown;
import com.flagship.point_ledger.ledger.exception.InvalidAmountException;
import com.flagship.point_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.point_ledger.ledger.exception.PointLedgerException;
import com.flagship.point_ledger.observability.LedgerMetrics;
import com.flagship.point_ledger.store.EntryOrder;
import com.flagship.point_ledger.store.HistoryFilter;
import com.flagship.point_ledger.store.LedgerStore;
import com.flagship.point_ledger.store.WriteBatch;
import com.flagship.point_ledger.sweep.MaturationSweeper;
import com.flagship.point_ledger.sweep.SweepReport;
import com.flagship.point_ledger.usage.FifoConsumptionEngine;
import com.flagship.point_ledger.usage.RollbackEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the point ledger.
 *
 * Key principles:
 * - Every mutation goes through the store as one version-checked batch
 * - Grants, spends and rollbacks never delete history; they append entries or move statuses forward
 * - Balances are always derived from the entries, never stored
 *
 * Business rejections (invalid amount, insufficient funds, unknown or repeated rollback) are
 * logged at WARN and rethrown unchanged. Integrity alerts and exhausted retries are logged at
 * ERROR with full context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PointLedgerService {

    private static final String MDC_USER_ID = "userId";
    private static final String MDC_USAGE_RECORD_ID = "usageRecordId";

    private final LedgerStore store;
    private final AccrualCalculator accrualCalculator;
    private final FifoConsumptionEngine consumptionEngine;
    private final RollbackEngine rollbackEngine;
    private final MaturationSweeper sweeper;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Creates a grant. Earned credits start PENDING for the holding period;
     * admin grants are AVAILABLE at once.
     *
     * @throws InvalidAmountException if baseAmount cannot produce a grant of this kind
     */
    public LedgerEntry createGrant(UUID userId, EntryKind kind, long baseAmount, GrantContext context) {
        return withUser("createGrant", userId, () -> grant(userId, kind, baseAmount,
            context != null ? context : GrantContext.none()));
    }

    public BalanceSnapshot getBalance(UUID userId) {
        return getBalance(userId, clock.instant());
    }

    /**
     * Balances as of {@code asOf}, computed from one read of the user's entries.
     */
    public BalanceSnapshot getBalance(UUID userId, Instant asOf) {
        return BalanceAggregator.aggregate(userId, store.findByUser(userId, null, EntryOrder.FIFO), asOf);
    }

    /**
     * Spends points FIFO against a reservation.
     *
     * @return the COMMITTED usage record listing every grant drawn on
     */
    public UsageRecord spend(UUID userId, long amount, UUID reservationId) {
        return withUser("spend", userId, () -> {
            log.info("Spending points: amount={}, reservationId={}", amount, reservationId);
            UsageRecord usage = consumptionEngine.spend(userId, amount, reservationId);
            metrics.recordSpend(amount);
            log.info("Points spent: usageRecordId={}, amount={}, grantsDrawn={}",
                usage.getId(), amount, usage.getConsumedFrom().size());
            return usage;
        });
    }

    /**
     * Reverses a committed usage, giving every drawn point back to its grant.
     *
     * @return the usage record in ROLLED_BACK status
     */
    public UsageRecord rollback(UUID usageRecordId, String reason) {
        MDC.put(MDC_USAGE_RECORD_ID, usageRecordId.toString());
        try {
            // Unknown records are reported by the engine; here only the MDC needs the owner
            store.getUsageRecord(usageRecordId)
                .ifPresent(usage -> MDC.put(MDC_USER_ID, usage.getUserId().toString()));
            return timed("rollback", () -> {
                log.info("Rolling back usage: reason={}", reason);
                UsageRecord rolledBack = rollbackEngine.rollback(usageRecordId, reason);
                metrics.recordRollback(rolledBack.getTotalAmount());
                log.info("Usage rolled back: restored={}, grants={}",
                    rolledBack.getTotalAmount(), rolledBack.getConsumedFrom().size());
                return rolledBack;
            });
        } finally {
            MDC.remove(MDC_USAGE_RECORD_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    /**
     * A page of the user's entries, newest first.
     */
    public Page<LedgerEntry> listHistory(UUID userId, HistoryFilter filter, Pageable pageable) {
        return store.findHistory(userId, filter != null ? filter : HistoryFilter.none(), pageable);
    }

    public SweepReport sweepMaturation(Instant now) {
        return timed("sweepMaturation", () -> {
            SweepReport report = sweeper.maturePending(now);
            metrics.recordMatured(report.getProcessed());
            logSweep(report);
            return report;
        });
    }

    public SweepReport sweepExpiration(Instant now) {
        return timed("sweepExpiration", () -> {
            SweepReport report = sweeper.expireAvailable(now);
            metrics.recordExpired(report.getPointsForfeited());
            logSweep(report);
            return report;
        });
    }

    /**
     * Manual correction by an operator.
     * A positive amount is an immediately available grant; a negative one is deducted FIFO
     * and can be rolled back through the returned entry's linked usage record.
     *
     * @return the admin grant, or the spend entry of the deduction
     * @throws IllegalArgumentException if reason is blank
     * @throws InvalidAmountException if signedAmount is zero
     */
    public LedgerEntry adjustByAdmin(UUID userId, long signedAmount, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Admin adjustments require a reason");
        }
        return withUser("adjustByAdmin", userId, () -> {
            if (signedAmount == 0) {
                throw new InvalidAmountException("Admin adjustment amount must not be zero");
            }
            log.info("Admin adjustment: amount={}, reason={}", signedAmount, reason);
            if (signedAmount > 0) {
                return grant(userId, EntryKind.ADJUSTED_BY_ADMIN, signedAmount,
                    GrantContext.builder().reason(reason).description(reason).build());
            }
            long deducted = -signedAmount;
            UsageRecord usage = consumptionEngine.deduct(userId, deducted, reason);
            metrics.recordSpend(deducted);
            log.info("Admin deduction applied: usageRecordId={}, amount={}", usage.getId(), deducted);
            return store.getEntry(usage.getSpendEntryId())
                .orElseThrow(() -> new IllegalStateException(
                    "Spend entry " + usage.getSpendEntryId() + " missing right after commit"));
        });
    }

    /**
     * The grants a spend would draw on right now, oldest first.
     */
    public FifoBreakdown getFifoBreakdown(UUID userId, Instant now) {
        return BalanceAggregator.fifoBreakdown(userId,
            store.findByUser(userId, EntryStatus.AVAILABLE, EntryOrder.FIFO), now);
    }

    private LedgerEntry grant(UUID userId, EntryKind kind, long baseAmount, GrantContext context) {
        Instant now = clock.instant();
        LedgerEntry entry = accrualCalculator.newGrant(userId, kind, baseAmount, context, now);
        store.atomicWrite(new WriteBatch().insertEntry(entry));
        metrics.recordGrant(kind.name(), entry.getAmount());
        log.info("Grant created: entryId={}, kind={}, amount={}, status={}, availableFrom={}, expiresAt={}",
            entry.getId(), kind, entry.getAmount(), entry.getStatus(), entry.getAvailableFrom(), entry.getExpiresAt());
        return entry;
    }

    private <T> T withUser(String operation, UUID userId, Supplier<T> body) {
        MDC.put(MDC_USER_ID, userId.toString());
        try {
            return timed(operation, body);
        } finally {
            MDC.remove(MDC_USER_ID);
        }
    }

    private <T> T timed(String operation, Supplier<T> body) {
        try {
            return metrics.time(operation, body);
        } catch (PointLedgerException e) {
            LedgerErrorCode code = e.getErrorCode();
            if (code.isBusinessRule()) {
                log.warn("Request rejected: operation={}, code={}, reason={}", operation, code, e.getMessage());
                metrics.recordRejection(code.name());
            } else if (code == LedgerErrorCode.PARTIAL_STATE_CORRUPTION) {
                log.error("Ledger integrity alert, manual audit required: operation={}, error={}",
                    operation, e.getMessage());
                metrics.recordIntegrityAlert();
            } else {
                log.error("Operation failed: operation={}, code={}, error={}", operation, code, e.getMessage());
            }
            throw e;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request: operation={}, error={}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Operation failed unexpectedly: operation={}, error={}", operation, e.getMessage(), e);
            throw e;
        }
    }

    private void logSweep(SweepReport report) {
        if (report.hasFailures()) {
            metrics.recordSweepFailures(report.getSweep(), report.getFailedCount());
            log.warn("Sweep finished with failures: sweep={}, examined={}, processed={}, skipped={}, failed={}",
                report.getSweep(), report.getExamined(), report.getProcessed(), report.getSkipped(),
                report.getFailedCount());
        } else {
            log.info("Sweep finished: sweep={}, examined={}, processed={}, skipped={}, pointsForfeited={}",
                report.getSweep(), report.getExamined(), report.getProcessed(), report.getSkipped(),
                report.getPointsForfeited());
        }
    }
}
