package com.flagship.point_ledger.config;

import com.flagship.point_ledger.accrual.AccrualCalculator;
import com.flagship.point_ledger.accrual.AccrualPolicy;
import com.flagship.point_ledger.observability.LedgerMetrics;
import com.flagship.point_ledger.store.OptimisticRetryExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Point ledger configuration.
 *
 * Binds the point-ledger.* properties:
 * - accrual: earning rate, eligibility cap, referral bonus, holding and validity periods
 * - retry: bounded optimistic-concurrency retry budget and backoff
 */
@Configuration
public class LedgerConfig {

    @Value("${point-ledger.accrual.earning-rate:0.025}")
    private BigDecimal earningRate;

    @Value("${point-ledger.accrual.eligibility-cap:300000}")
    private long eligibilityCap;

    @Value("${point-ledger.accrual.referral-bonus:1000}")
    private long referralBonus;

    @Value("${point-ledger.accrual.holding-period:P7D}")
    private Duration holdingPeriod;

    @Value("${point-ledger.accrual.validity-period:P365D}")
    private Duration validityPeriod;

    @Value("${point-ledger.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${point-ledger.retry.initial-backoff-ms:10}")
    private long initialBackoffMs;

    @Value("${point-ledger.retry.max-backoff-ms:200}")
    private long maxBackoffMs;

    /**
     * Source of "now" for every ledger operation. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccrualPolicy accrualPolicy() {
        return new AccrualPolicy(earningRate, eligibilityCap, referralBonus, holdingPeriod, validityPeriod);
    }

    @Bean
    public AccrualCalculator accrualCalculator(AccrualPolicy accrualPolicy) {
        return new AccrualCalculator(accrualPolicy);
    }

    @Bean
    public OptimisticRetryExecutor optimisticRetryExecutor(LedgerMetrics ledgerMetrics) {
        return new OptimisticRetryExecutor(maxAttempts, initialBackoffMs, maxBackoffMs, ledgerMetrics);
    }
}
