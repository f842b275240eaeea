package com.flagship.point_ledger.accrual;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Computes the amount and the holding and expiry instants of a new grant.
 *
 * Pure: it reads no store and creates nothing by itself. The caller persists the
 * entry returned by {@link #newGrant}.
 */
public class AccrualCalculator {

    private static final long INFLUENCER_FACTOR = 2L;

    private final AccrualPolicy policy;

    public AccrualCalculator(AccrualPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param baseAmount purchase amount for EARNED_SERVICE, the bonus for INFLUENCER_BONUS,
     *                   a positive trigger amount for EARNED_REFERRAL, the grant for ADJUSTED_BY_ADMIN
     * @throws InvalidAmountException if the amount cannot produce a grant of this kind
     * @throws IllegalArgumentException if the kind is only ever recorded by spend or sweep,
     *                                  or an admin grant has no reason
     */
    public GrantTerms calculate(EntryKind kind, long baseAmount, GrantContext context, Instant now) {
        if (kind.isEngineRecorded()) {
            if (baseAmount >= 0) {
                throw new InvalidAmountException(
                    String.format("%s entries must carry a negative amount, got %d", kind, baseAmount));
            }
            throw new IllegalArgumentException(kind + " entries are recorded only by spend and expiration");
        }
        if (baseAmount <= 0) {
            throw new InvalidAmountException(
                String.format("%s requires a positive amount, got %d", kind, baseAmount));
        }

        if (kind == EntryKind.ADJUSTED_BY_ADMIN) {
            if (context.getReason() == null || context.getReason().isBlank()) {
                throw new IllegalArgumentException("Admin adjustments require a reason");
            }
            return new GrantTerms(kind, baseAmount, EntryStatus.AVAILABLE, now,
                now.plus(policy.getValidityPeriod()));
        }

        long amount = switch (kind) {
            case EARNED_SERVICE -> earnedServicePoints(baseAmount, context);
            case EARNED_REFERRAL -> policy.getReferralBonus();
            case INFLUENCER_BONUS -> context.isInfluencer()
                ? Math.multiplyExact(baseAmount, INFLUENCER_FACTOR)
                : baseAmount;
            default -> throw new IllegalArgumentException("Unsupported grant kind " + kind);
        };
        if (amount <= 0) {
            throw new InvalidAmountException(
                String.format("Purchase amount %d is too small to earn points", baseAmount));
        }

        Instant availableFrom = now.plus(policy.getHoldingPeriod());
        return new GrantTerms(kind, amount, EntryStatus.PENDING, availableFrom,
            availableFrom.plus(policy.getValidityPeriod()));
    }

    /**
     * Builds the (unsaved) grant entry for the computed terms.
     */
    public LedgerEntry newGrant(UUID userId, EntryKind kind, long baseAmount, GrantContext context, Instant now) {
        GrantTerms terms = calculate(kind, baseAmount, context, now);
        String description = context.getDescription() != null ? context.getDescription() : context.getReason();
        return LedgerEntry.grant(UUID.randomUUID(), userId, terms.getKind(), terms.getAmount(),
            terms.getInitialStatus(), terms.getAvailableFrom(), terms.getExpiresAt(),
            context.getReservationId(), description, now);
    }

    // floor(floor(min(base, cap) * rate) * tier), doubled for influencers
    private long earnedServicePoints(long purchaseAmount, GrantContext context) {
        BigDecimal tier = context.getTierMultiplier() == null ? BigDecimal.ONE : context.getTierMultiplier();
        if (tier.signum() <= 0) {
            throw new IllegalArgumentException("Tier multiplier must be positive, got " + tier);
        }
        BigDecimal eligible = BigDecimal.valueOf(Math.min(purchaseAmount, policy.getEligibilityCap()));
        BigDecimal base = eligible.multiply(policy.getEarningRate()).setScale(0, RoundingMode.FLOOR);
        long points = base.multiply(tier).setScale(0, RoundingMode.FLOOR).longValueExact();
        return context.isInfluencer() ? Math.multiplyExact(points, INFLUENCER_FACTOR) : points;
    }

    public AccrualPolicy getPolicy() {
        return policy;
    }
}
