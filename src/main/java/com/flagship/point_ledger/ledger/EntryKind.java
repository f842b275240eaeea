package com.flagship.point_ledger.ledger;

/**
 * What a ledger entry records.
 *
 * The kind fixes the sign an entry's amount may carry:
 * earning kinds are strictly positive, USED_SERVICE and EXPIRED strictly negative,
 * and ADJUSTED_BY_ADMIN may be either (a positive adjustment is a grant, a negative one a deduction).
 */
public enum EntryKind {
    /**
     * Points earned for a completed purchase.
     */
    EARNED_SERVICE,

    /**
     * Fixed bonus for a successful referral.
     */
    EARNED_REFERRAL,

    /**
     * Bonus credited for influencer activity.
     */
    INFLUENCER_BONUS,

    /**
     * Points spent against a reservation.
     */
    USED_SERVICE,

    /**
     * Remainder forfeited when a grant passed its expiry.
     */
    EXPIRED,

    /**
     * Manual correction by an operator. Requires a reason.
     */
    ADJUSTED_BY_ADMIN;

    public boolean isEarning() {
        return this == EARNED_SERVICE || this == EARNED_REFERRAL || this == INFLUENCER_BONUS;
    }

    /**
     * Kinds that are only ever written by the engine itself (spend and sweep), never granted.
     */
    public boolean isEngineRecorded() {
        return this == USED_SERVICE || this == EXPIRED;
    }

    /**
     * Checks whether an amount carries the sign this kind allows.
     */
    public boolean allowsAmount(long amount) {
        return switch (this) {
            case EARNED_SERVICE, EARNED_REFERRAL, INFLUENCER_BONUS -> amount > 0;
            case USED_SERVICE, EXPIRED -> amount < 0;
            case ADJUSTED_BY_ADMIN -> amount != 0;
        };
    }
}
