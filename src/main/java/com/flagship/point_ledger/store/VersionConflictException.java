package com.flagship.point_ledger.store;

import java.util.UUID;

/**
 * A conditional write found a row at a different version than the one it read.
 * The whole batch was discarded; the caller retries from its read step.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String entity, UUID id, Long expectedVersion) {
        super(String.format("%s %s changed concurrently (expected version %s)", entity, id, expectedVersion));
    }
}
