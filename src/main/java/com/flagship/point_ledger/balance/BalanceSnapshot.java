package com.flagship.point_ledger.balance;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's point totals as of one instant, derived from one read of their entries.
 *
 * totalEarned - totalUsed - expiredBalance - pendingBalance == availableBalance always holds.
 */
@Value
public class BalanceSnapshot {
    UUID userId;
    Instant asOf;
    long totalEarned;
    long totalUsed;
    long availableBalance;
    long pendingBalance;
    long expiredBalance;
}
