package com.flagship.point_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A spend asked for more points than the user can draw on. Nothing was mutated.
 */
@Getter
public class InsufficientFundsException extends PointLedgerException {

    private final UUID userId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(UUID userId, long requested, long available) {
        super(LedgerErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient points: requested=%d, available=%d", requested, available));
        this.userId = userId;
        this.requested = requested;
        this.available = available;
    }
}
