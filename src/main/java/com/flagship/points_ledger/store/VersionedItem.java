package com.flagship.points_ledger.store;

import lombok.Value;

import java.time.Instant;

/**
 * An item as read from the store, with the version metadata needed for
 * conditional updates. Versions start at 1 and advance by exactly one on
 * every successful write.
 */
@Value
public class VersionedItem {
    ItemKey key;
    String payload;
    long version;
    Instant updatedAt;
}
