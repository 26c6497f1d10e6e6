package com.flagship.points_ledger.catalog;

import lombok.Value;

import java.time.Instant;

/**
 * A reward users can redeem points for.
 *
 * {@code stock} is optional; null means unlimited.
 */
@Value
public class RewardCatalogEntry {
    String rewardId;
    String title;
    String description;
    long cost;
    Long stock;
    Instant createdAt;
    Instant updatedAt;

    public boolean isInStock() {
        return stock == null || stock > 0;
    }
}
