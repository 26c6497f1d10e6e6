package com.flagship.points_ledger.store;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Capability interface over a key-value store offering single-row atomicity only.
 *
 * Nothing above this interface may assume that two calls are applied atomically
 * together. Every backend failure is reported as
 * {@link com.flagship.points_ledger.error.StoreUnavailableException}.
 */
public interface KeyValueStore {

    Optional<VersionedItem> get(ItemKey key);

    /**
     * Unconditional write. Creates the item at version 1 or advances the version
     * of an existing one. Only for first writes and administrative data.
     */
    void put(ItemKey key, String payload);

    /**
     * Creates the item only if no item exists under the key.
     *
     * @return the created item (version 1)
     * @throws ItemAlreadyExistsException if the key is already present
     */
    VersionedItem putIfAbsent(ItemKey key, String payload);

    /**
     * Replaces the payload only if the stored version equals {@code expectedVersion}.
     *
     * @return the updated item (version {@code expectedVersion + 1})
     * @throws VersionConflictException if the stored version moved on or the item is gone
     */
    VersionedItem updateIfVersion(ItemKey key, String payload, long expectedVersion);

    /**
     * Lazily streams every item of one partition ordered by sort key.
     * The returned stream may hold backend resources and must be closed.
     */
    Stream<VersionedItem> queryByPartition(String family, String partitionKey);

    /**
     * Cheap round-trip used by health checks.
     */
    boolean isReachable();
}
