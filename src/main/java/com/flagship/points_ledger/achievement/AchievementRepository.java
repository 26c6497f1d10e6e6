package com.flagship.points_ledger.achievement;

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
 * Persistence for {@link AchievementRecord}s, partitioned by user.
 */
@Repository
@RequiredArgsConstructor
public class AchievementRepository {

    static final String FAMILY = "achievement";

    private final KeyValueStore store;
    private final DocumentMapper documentMapper;

    /**
     * Stores a new record.
     *
     * @throws com.flagship.points_ledger.store.ItemAlreadyExistsException if the user already has this achievement
     */
    public AchievementRecord create(AchievementRecord record) {
        VersionedItem created = store.putIfAbsent(
            keyFor(record.getUserId(), record.getAchievementId()),
            documentMapper.write(AchievementDocument.fromDomain(record)));
        return toDomain(created);
    }

    public Optional<AchievementRecord> find(String userId, String achievementId) {
        return store.get(keyFor(userId, achievementId)).map(this::toDomain);
    }

    /**
     * Writes {@code next} only if the stored record is still at {@code next.getVersion()}.
     *
     * @throws com.flagship.points_ledger.store.VersionConflictException if another write landed first
     */
    public AchievementRecord update(AchievementRecord next) {
        VersionedItem stored = store.updateIfVersion(
            keyFor(next.getUserId(), next.getAchievementId()),
            documentMapper.write(AchievementDocument.fromDomain(next)),
            next.getVersion());
        return toDomain(stored);
    }

    public List<AchievementRecord> findByUser(String userId) {
        try (Stream<VersionedItem> items = store.queryByPartition(FAMILY, userId)) {
            return items.map(this::toDomain).toList();
        }
    }

    private AchievementRecord toDomain(VersionedItem item) {
        return documentMapper.read(item, AchievementDocument.class).toDomain(item.getVersion());
    }

    private static ItemKey keyFor(String userId, String achievementId) {
        return ItemKey.of(FAMILY, userId, achievementId);
    }
}
