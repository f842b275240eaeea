package com.flagship.point_ledger.accrual;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Earning rules applied when a grant is created.
 */
@Value
public class AccrualPolicy {
    /**
     * Fraction of the eligible purchase amount earned as points.
     */
    BigDecimal earningRate;

    /**
     * Purchase amount above which no further points are earned.
     */
    long eligibilityCap;

    /**
     * Fixed points for one successful referral.
     */
    long referralBonus;

    /**
     * Time a new earned credit stays PENDING.
     */
    Duration holdingPeriod;

    /**
     * Lifetime of a credit once it becomes available.
     */
    Duration validityPeriod;

    public AccrualPolicy(BigDecimal earningRate, long eligibilityCap, long referralBonus,
                         Duration holdingPeriod, Duration validityPeriod) {
        if (earningRate == null || earningRate.signum() <= 0) {
            throw new IllegalArgumentException("Earning rate must be positive");
        }
        if (eligibilityCap <= 0 || referralBonus <= 0) {
            throw new IllegalArgumentException("Eligibility cap and referral bonus must be positive");
        }
        if (holdingPeriod.isNegative() || validityPeriod.isNegative() || validityPeriod.isZero()) {
            throw new IllegalArgumentException("Holding period must not be negative and validity must be positive");
        }
        this.earningRate = earningRate;
        this.eligibilityCap = eligibilityCap;
        this.referralBonus = referralBonus;
        this.holdingPeriod = holdingPeriod;
        this.validityPeriod = validityPeriod;
    }

    /**
     * 2.5% of up to 300,000, 1,000 per referral, held 7 days, valid 365 days.
     */
    public static AccrualPolicy defaults() {
        return new AccrualPolicy(new BigDecimal("0.025"), 300_000L, 1_000L,
            Duration.ofDays(7), Duration.ofDays(365));
    }
}
