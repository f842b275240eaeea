package com.flagship.point_ledger.sweep;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one sweep pass. Failures are per entry; one failed entry never stops the pass.
 */
@Value
public class SweepReport {
    String sweep;
    Instant runAt;
    int examined;
    int processed;

    /**
     * Entries another writer had already moved on by the time the sweep reached them.
     */
    int skipped;

    /**
     * Points forfeited by this pass. Always zero for maturation.
     */
    long pointsForfeited;

    List<SweepFailure> failures;

    public int getFailedCount() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Value
    public static class SweepFailure {
        UUID entryId;
        String reason;
    }
}
