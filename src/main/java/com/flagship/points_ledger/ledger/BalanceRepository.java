package com.flagship.points_ledger.ledger;

import com.flagship.points_ledger.store.DocumentMapper;
import com.flagship.points_ledger.store.ItemAlreadyExistsException;
import com.flagship.points_ledger.store.ItemKey;
import com.flagship.points_ledger.store.KeyValueStore;
import com.flagship.points_ledger.store.VersionedItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Reads and conditionally writes {@link PointBalance} records.
 * Only {@link PointLedger} mutates balances.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class BalanceRepository {

    static final String FAMILY = "point_balance";
    private static final String SORT_KEY = "balance";

    private final KeyValueStore store;
    private final DocumentMapper documentMapper;

    public Optional<PointBalance> find(String userId) {
        return store.get(keyFor(userId)).map(this::toDomain);
    }

    /**
     * Returns the stored balance, creating the zero record first if the user has none.
     * Losing the creation race to another replica is benign: the winner's record is re-read.
     */
    public PointBalance findOrCreate(String userId) {
        Optional<PointBalance> existing = find(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            VersionedItem created = store.putIfAbsent(
                keyFor(userId), documentMapper.write(PointBalanceDocument.fromDomain(PointBalance.initial(userId))));
            log.debug("Created balance record for user {}", userId);
            return toDomain(created);
        } catch (ItemAlreadyExistsException e) {
            log.debug("Balance record for user {} created concurrently, re-reading", userId);
            return find(userId).orElseThrow(() -> new IllegalStateException(
                "Balance record for user " + userId + " reported as existing but not readable"));
        }
    }

    /**
     * Writes {@code next} only if the stored record is still at {@code expectedVersion}.
     *
     * @throws com.flagship.points_ledger.store.VersionConflictException if another write landed first
     */
    public PointBalance update(PointBalance next, long expectedVersion) {
        VersionedItem stored = store.updateIfVersion(
            keyFor(next.getUserId()), documentMapper.write(PointBalanceDocument.fromDomain(next)), expectedVersion);
        return toDomain(stored);
    }

    private PointBalance toDomain(VersionedItem item) {
        return documentMapper.read(item, PointBalanceDocument.class).toDomain(item.getVersion());
    }

    private static ItemKey keyFor(String userId) {
        return ItemKey.of(FAMILY, userId, SORT_KEY);
    }
}
