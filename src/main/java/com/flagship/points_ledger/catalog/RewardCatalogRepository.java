package com.flagship.points_ledger.catalog;

import com.flagship.points_ledger.store.DocumentMapper;
import com.flagship.points_ledger.store.ItemKey;
import com.flagship.points_ledger.store.KeyValueStore;
import com.flagship.points_ledger.store.VersionedItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reward catalog entries, all held in one partition so the catalog can be listed.
 */
@Repository
@RequiredArgsConstructor
public class RewardCatalogRepository {

    static final String FAMILY = "reward_catalog";
    static final String PARTITION = "catalog";

    private final KeyValueStore store;
    private final DocumentMapper documentMapper;

    public Optional<RewardCatalogEntry> find(String rewardId) {
        return store.get(keyFor(rewardId)).map(this::toDomain);
    }

    /**
     * Creates or replaces the entry. Catalog maintenance is administrative, so
     * the last write wins.
     */
    public RewardCatalogEntry save(RewardCatalogEntry entry) {
        store.put(keyFor(entry.getRewardId()), documentMapper.write(RewardCatalogDocument.fromDomain(entry)));
        return entry;
    }

    public List<RewardCatalogEntry> findAll() {
        try (Stream<VersionedItem> items = store.queryByPartition(FAMILY, PARTITION)) {
            return items.map(this::toDomain).toList();
        }
    }

    private RewardCatalogEntry toDomain(VersionedItem item) {
        return documentMapper.read(item, RewardCatalogDocument.class).toDomain();
    }

    private static ItemKey keyFor(String rewardId) {
        return ItemKey.of(FAMILY, PARTITION, rewardId);
    }
}
