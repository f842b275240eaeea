package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.exception.TransientFailureException;
import com.flagship.point_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a read-compute-write attempt until its batch commits without a version conflict.
 *
 * Each retry starts again from the read step, so a retried attempt never applies a stale plan.
 * Only concurrency failures are retried; business exceptions pass straight through.
 * When the budget is spent the conflict is surfaced as {@link TransientFailureException}.
 */
@Slf4j
public class OptimisticRetryExecutor {

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;
    private final LedgerMetrics metrics;

    public OptimisticRetryExecutor(int maxAttempts, long initialBackoffMs, long maxBackoffMs, LedgerMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.metrics = metrics;
        long initial = Math.max(1L, initialBackoffMs);
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(initial, 2.0, Math.max(initial + 1, maxBackoffMs), true)
            .retryOn(List.of(VersionConflictException.class, ConcurrencyFailureException.class))
            .build();
    }

    /**
     * @param operation name used in logs and metrics
     * @param attempt one full read-compute-write pass
     * @throws TransientFailureException if every attempt lost a concurrent race
     */
    public <T> T execute(String operation, Supplier<T> attempt) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying after concurrent modification: operation={}, attempt={}, cause={}",
                        operation, context.getRetryCount() + 1,
                        context.getLastThrowable() != null ? context.getLastThrowable().getMessage() : null);
                    metrics.recordVersionConflictRetry(operation);
                }
                return attempt.get();
            });
        } catch (VersionConflictException | ConcurrencyFailureException e) {
            log.error("Optimistic retries exhausted: operation={}, attempts={}, lastConflict={}",
                operation, maxAttempts, e.getMessage());
            metrics.recordRetriesExhausted(operation);
            throw new TransientFailureException(operation, maxAttempts, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
