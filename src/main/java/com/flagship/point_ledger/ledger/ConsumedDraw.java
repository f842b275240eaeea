package com.flagship.point_ledger.ledger;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * One line of a FIFO breakdown: how much a usage took from a single grant entry.
 */
@Value
public class ConsumedDraw {
    UUID grantEntryId;
    long amountDrawn;

    private ConsumedDraw(UUID grantEntryId, long amountDrawn) {
        this.grantEntryId = Objects.requireNonNull(grantEntryId);
        if (amountDrawn <= 0) {
            throw new IllegalArgumentException("Drawn amount must be positive");
        }
        this.amountDrawn = amountDrawn;
    }

    public static ConsumedDraw of(UUID grantEntryId, long amountDrawn) {
        return new ConsumedDraw(grantEntryId, amountDrawn);
    }
}
