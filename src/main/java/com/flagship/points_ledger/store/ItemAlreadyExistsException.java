package com.flagship.points_ledger.store;

import lombok.Getter;

/**
 * Raised by {@link KeyValueStore#putIfAbsent} when the key is already taken.
 */
@Getter
public class ItemAlreadyExistsException extends RuntimeException {

    private final ItemKey key;

    public ItemAlreadyExistsException(ItemKey key) {
        super("Item already exists: " + key);
        this.key = key;
    }
}
