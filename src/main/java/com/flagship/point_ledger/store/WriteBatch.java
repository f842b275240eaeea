package com.flagship.point_ledger.store;

import com.flagship.point_ledger.ledger.LedgerEntry;
import com.flagship.point_ledger.ledger.UsageRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of writes the store applies all-or-nothing.
 *
 * Inserts carry no expected version. Updates carry the version the caller read; the store
 * rejects the whole batch with {@link VersionConflictException} if any row moved on since.
 */
public class WriteBatch {

    private final List<Write<LedgerEntry>> entryWrites = new ArrayList<>();
    private final List<Write<UsageRecord>> usageWrites = new ArrayList<>();

    public WriteBatch insertEntry(LedgerEntry entry) {
        entryWrites.add(new Write<>(entry, null));
        return this;
    }

    /**
     * @param current the entry as read, whose version is the expected one
     * @param newState the state to write
     */
    public WriteBatch updateEntry(LedgerEntry current, LedgerEntry newState) {
        requireSameId(current.getId(), newState.getId());
        entryWrites.add(new Write<>(newState, current.getVersion()));
        return this;
    }

    public WriteBatch insertUsage(UsageRecord record) {
        usageWrites.add(new Write<>(record, null));
        return this;
    }

    public WriteBatch updateUsage(UsageRecord current, UsageRecord newState) {
        requireSameId(current.getId(), newState.getId());
        usageWrites.add(new Write<>(newState, current.getVersion()));
        return this;
    }

    public List<Write<LedgerEntry>> getEntryWrites() {
        return Collections.unmodifiableList(entryWrites);
    }

    public List<Write<UsageRecord>> getUsageWrites() {
        return Collections.unmodifiableList(usageWrites);
    }

    public boolean isEmpty() {
        return entryWrites.isEmpty() && usageWrites.isEmpty();
    }

    public int size() {
        return entryWrites.size() + usageWrites.size();
    }

    private static void requireSameId(Object currentId, Object newId) {
        if (!currentId.equals(newId)) {
            throw new IllegalArgumentException("Update must keep the row id: " + currentId + " vs " + newId);
        }
    }

    /**
     * One row write. A null expectedVersion means insert.
     */
    @Value
    public static class Write<T> {
        T newState;
        Long expectedVersion;

        public boolean isInsert() {
            return expectedVersion == null;
        }
    }
}
