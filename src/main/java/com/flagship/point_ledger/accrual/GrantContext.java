package com.flagship.point_ledger.accrual;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Caller-supplied facts about the user and the triggering event of a grant.
 * All fields are optional.
 */
@Value
@Builder
public class GrantContext {
    boolean influencer;

    /**
     * Membership tier factor applied to earned-service points. Null means 1.
     */
    BigDecimal tierMultiplier;

    /**
     * The purchase or reservation that earned the points.
     */
    UUID reservationId;

    String description;

    /**
     * Operator's reason. Required for admin adjustments.
     */
    String reason;

    public static GrantContext none() {
        return GrantContext.builder().build();
    }
}
