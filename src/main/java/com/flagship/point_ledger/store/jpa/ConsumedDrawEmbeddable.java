package com.flagship.point_ledger.store.jpa;

import com.flagship.point_ledger.ledger.ConsumedDraw;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsumedDrawEmbeddable {

    @Column(name = "grant_entry_id", nullable = false)
    private UUID grantEntryId;

    @Column(name = "amount_drawn", nullable = false)
    private long amountDrawn;

    static ConsumedDrawEmbeddable fromDomain(ConsumedDraw draw) {
        return new ConsumedDrawEmbeddable(draw.getGrantEntryId(), draw.getAmountDrawn());
    }

    ConsumedDraw toDomain() {
        return ConsumedDraw.of(grantEntryId, amountDrawn);
    }
}
