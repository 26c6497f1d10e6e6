package com.flagship.points_ledger.store;

import lombok.Value;

import java.util.Objects;

/**
 * Address of a single item in the {@link KeyValueStore}.
 *
 * The record family plays the role of a table, the partition key groups the
 * items that can be read together with {@link KeyValueStore#queryByPartition},
 * and the sort key identifies one item inside its partition.
 */
@Value
public class ItemKey {
    String family;
    String partitionKey;
    String sortKey;

    private ItemKey(String family, String partitionKey, String sortKey) {
        this.family = requireText(family, "family");
        this.partitionKey = requireText(partitionKey, "partitionKey");
        this.sortKey = requireText(sortKey, "sortKey");
    }

    public static ItemKey of(String family, String partitionKey, String sortKey) {
        return new ItemKey(family, partitionKey, sortKey);
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        return value;
    }

    @Override
    public String toString() {
        return family + "/" + partitionKey + "/" + sortKey;
    }
}
