package com.flagship.points_ledger.catalog;

import com.flagship.points_ledger.error.RewardNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Maintains the reward catalog.
 *
 * Entries can be created and updated but never deleted, since redemption
 * history refers to reward IDs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardCatalogService {

    private final RewardCatalogRepository catalog;

    /**
     * Creates a reward or replaces an existing one, keeping its creation time.
     *
     * @param stock remaining units, or null for unlimited
     * @throws IllegalArgumentException if the title is blank, the cost is not positive or the stock is negative
     */
    public RewardCatalogEntry save(String rewardId, String title, String description, long cost, Long stock) {
        if (rewardId == null || rewardId.isBlank()) {
            throw new IllegalArgumentException("Reward ID is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Reward title is required");
        }
        if (cost <= 0) {
            throw new IllegalArgumentException("Reward cost must be positive");
        }
        if (stock != null && stock < 0) {
            throw new IllegalArgumentException("Reward stock cannot be negative");
        }

        Instant now = Instant.now();
        Instant createdAt = catalog.find(rewardId).map(RewardCatalogEntry::getCreatedAt).orElse(now);
        RewardCatalogEntry saved = catalog.save(
            new RewardCatalogEntry(rewardId, title, description, cost, stock, createdAt, now));

        log.info("Reward {} saved: cost={}, stock={}", rewardId, cost, stock == null ? "unlimited" : stock);
        return saved;
    }

    /**
     * @throws RewardNotFoundException if no such reward exists
     */
    public RewardCatalogEntry get(String rewardId) {
        if (rewardId == null || rewardId.isBlank()) {
            throw new IllegalArgumentException("Reward ID is required");
        }
        return catalog.find(rewardId).orElseThrow(() -> new RewardNotFoundException(rewardId));
    }

    public List<RewardCatalogEntry> list() {
        return catalog.findAll();
    }
}
