package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.EntryKind;
import com.flagship.point_ledger.ledger.EntryStatus;
import com.flagship.point_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for a user's history listing. Null fields do not filter.
 * The createdAt range is inclusive on both ends.
 */
@Value
@Builder
public class HistoryFilter {
    EntryKind kind;
    EntryStatus status;
    Instant from;
    Instant to;

    public static HistoryFilter none() {
        return HistoryFilter.builder().build();
    }

    public boolean matches(LedgerEntry entry) {
        if (kind != null && entry.getKind() != kind) {
            return false;
        }
        if (status != null && entry.getStatus() != status) {
            return false;
        }
        if (from != null && entry.getCreatedAt().isBefore(from)) {
            return false;
        }
        return to == null || !entry.getCreatedAt().isAfter(to);
    }
}
