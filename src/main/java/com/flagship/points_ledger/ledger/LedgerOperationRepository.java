package com.flagship.points_ledger.ledger;

import com.flagship.points_ledger.store.DocumentMapper;
import com.flagship.points_ledger.store.ItemAlreadyExistsException;
import com.flagship.points_ledger.store.ItemKey;
import com.flagship.points_ledger.store.KeyValueStore;
import com.flagship.points_ledger.store.VersionedItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only markers of applied ledger operations, one per (user, idempotency key).
 *
 * A marker is written after the balance update it describes has landed, so a
 * marker never exists for an operation that did not happen. The markers outlive
 * the bounded recent-operations list on the balance record and form the user's
 * points history.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LedgerOperationRepository {

    static final String FAMILY = "ledger_operation";

    private final KeyValueStore store;
    private final DocumentMapper documentMapper;

    public Optional<AppliedOperation> find(String userId, String idempotencyKey) {
        return store.get(ItemKey.of(FAMILY, userId, idempotencyKey)).map(this::toDomain);
    }

    /**
     * Records the marker. An existing marker for the same key is left untouched.
     */
    public void record(String userId, AppliedOperation operation) {
        try {
            store.putIfAbsent(
                ItemKey.of(FAMILY, userId, operation.getIdempotencyKey()),
                documentMapper.write(AppliedOperationDocument.fromDomain(operation)));
        } catch (ItemAlreadyExistsException e) {
            log.debug("Ledger operation marker {} already recorded for user {}",
                operation.getIdempotencyKey(), userId);
        }
    }

    /**
     * Lists the user's applied operations ordered by application time.
     */
    public List<AppliedOperation> findByUser(String userId) {
        try (Stream<VersionedItem> items = store.queryByPartition(FAMILY, userId)) {
            return items.map(this::toDomain)
                .sorted(Comparator.comparing(AppliedOperation::getAppliedAt))
                .toList();
        }
    }

    private AppliedOperation toDomain(VersionedItem item) {
        return documentMapper.read(item, AppliedOperationDocument.class).toDomain();
    }
}
