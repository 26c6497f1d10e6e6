package com.flagship.points_ledger.reward;

import com.flagship.points_ledger.store.DocumentMapper;
import com.flagship.points_ledger.store.ItemKey;
import com.flagship.points_ledger.store.KeyValueStore;
import com.flagship.points_ledger.store.VersionedItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistence for {@link RedemptionRecord}s, partitioned by user and keyed by request ID.
 */
@Repository
@RequiredArgsConstructor
public class RedemptionRepository {

    static final String FAMILY = "redemption";

    private final KeyValueStore store;
    private final DocumentMapper documentMapper;

    /**
     * @throws com.flagship.points_ledger.store.ItemAlreadyExistsException if the request was already recorded
     */
    public RedemptionRecord create(RedemptionRecord record) {
        store.putIfAbsent(
            ItemKey.of(FAMILY, record.getUserId(), record.getRequestId()),
            documentMapper.write(RedemptionDocument.fromDomain(record)));
        return record;
    }

    public Optional<RedemptionRecord> find(String userId, String requestId) {
        return store.get(ItemKey.of(FAMILY, userId, requestId)).map(this::toDomain);
    }

    /**
     * Lists the user's redemptions, oldest first.
     */
    public List<RedemptionRecord> findByUser(String userId) {
        try (Stream<VersionedItem> items = store.queryByPartition(FAMILY, userId)) {
            return items.map(this::toDomain)
                .sorted(Comparator.comparing(RedemptionRecord::getRedeemedAt))
                .toList();
        }
    }

    private RedemptionRecord toDomain(VersionedItem item) {
        return documentMapper.read(item, RedemptionDocument.class).toDomain();
    }
}
