package com.flagship.point_ledger.accrual;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import lombok.Value;

import java.time.Instant;

/**
 * The computed shape of a new grant before it becomes a ledger entry.
 */
@Value
public class GrantTerms {
    EntryKind kind;
    long amount;
    EntryStatus initialStatus;
    Instant availableFrom;
    Instant expiresAt;
}
