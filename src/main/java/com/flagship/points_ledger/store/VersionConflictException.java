package com.flagship.points_ledger.store;

import lombok.Getter;

/**
 * Raised by {@link KeyValueStore#updateIfVersion} when the stored version no
 * longer matches the version the caller read.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final ItemKey key;
    private final long expectedVersion;

    public VersionConflictException(ItemKey key, long expectedVersion) {
        super(String.format("Version conflict on %s: expected version %d", key, expectedVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
    }
}
