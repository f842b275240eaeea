package com.flagship.point_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for point ledger operations.
 *
 * Metrics exposed:
 * - points.granted: Points credited, tagged by entry kind
 * - points.spent: Points consumed by FIFO usage and admin deductions
 * - points.rolled_back: Points restored by rollback
 * - points.matured / points.expired: Sweep outcomes
 * - ledger.rejections: Business-rule rejections, tagged by error code
 * - ledger.retry.conflicts / ledger.retry.exhausted: Optimistic concurrency behaviour
 * - ledger.integrity.alerts: Partial state corruption detected during rollback
 * - ledger.operation.duration: Timer per facade operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter pointsSpent;
    private final Counter pointsRolledBack;
    private final Counter integrityAlerts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pointsSpent = Counter.builder("points.spent")
                .description("Points consumed from grants")
                .baseUnit("points")
                .register(registry);

        this.pointsRolledBack = Counter.builder("points.rolled_back")
                .description("Points restored to grants by rollback")
                .baseUnit("points")
                .register(registry);

        this.integrityAlerts = Counter.builder("ledger.integrity.alerts")
                .description("Rollbacks aborted because ledger state was inconsistent")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void recordGrant(String kind, long amount) {
        registry.counter("points.granted", "kind", sanitizeTag(kind)).increment(amount);
    }

    public void recordSpend(long amount) {
        pointsSpent.increment(amount);
    }

    public void recordRollback(long amount) {
        pointsRolledBack.increment(amount);
    }

    public void recordMatured(int count) {
        registry.counter("points.matured").increment(count);
    }

    public void recordExpired(long forfeitedPoints) {
        registry.counter("points.expired").increment(forfeitedPoints);
    }

    public void recordSweepFailures(String sweep, int count) {
        registry.counter("ledger.sweep.failures", "sweep", sanitizeTag(sweep)).increment(count);
    }

    public void recordRejection(String errorCode) {
        registry.counter("ledger.rejections", "code", sanitizeTag(errorCode)).increment();
    }

    public void recordIntegrityAlert() {
        integrityAlerts.increment();
    }

    // ==================== Concurrency Metrics ====================

    public void recordVersionConflictRetry(String operation) {
        registry.counter("ledger.retry.conflicts", "operation", sanitizeTag(operation)).increment();
    }

    public void recordRetriesExhausted(String operation) {
        registry.counter("ledger.retry.exhausted", "operation", sanitizeTag(operation)).increment();
    }

    // ==================== Timer Methods ====================

    /**
     * Times a facade operation.
     */
    public <T> T time(String operation, Supplier<T> body) {
        return Timer.builder("ledger.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(body);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
