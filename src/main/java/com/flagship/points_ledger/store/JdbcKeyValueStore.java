package com.flagship.points_ledger.store;

import com.flagship.points_ledger.error.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link KeyValueStore} on a single PostgreSQL table.
 *
 * Every method issues exactly one statement, so each call is atomic on its own
 * and no call relies on a surrounding transaction:
 * - conditional put is {@code INSERT ... ON CONFLICT DO NOTHING} and checks the row count
 * - conditional update is {@code UPDATE ... WHERE version = ?} and checks the row count
 */
@Repository
@Slf4j
public class JdbcKeyValueStore implements KeyValueStore {

    private static final String SELECT_COLUMNS =
        "SELECT record_family, partition_key, sort_key, payload, version, updated_at FROM kv_items ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcKeyValueStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<VersionedItem> get(ItemKey key) {
        try {
            List<VersionedItem> rows = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE record_family = ? AND partition_key = ? AND sort_key = ?",
                itemRowMapper(),
                key.getFamily(), key.getPartitionKey(), key.getSortKey()
            );
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw unavailable("get", key, e);
        }
    }

    @Override
    public void put(ItemKey key, String payload) {
        try {
            jdbcTemplate.update(
                "INSERT INTO kv_items (record_family, partition_key, sort_key, payload, version, updated_at) " +
                "VALUES (?, ?, ?, ?, 1, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (record_family, partition_key, sort_key) " +
                "DO UPDATE SET payload = EXCLUDED.payload, version = kv_items.version + 1, updated_at = CURRENT_TIMESTAMP",
                key.getFamily(), key.getPartitionKey(), key.getSortKey(), payload
            );
        } catch (DataAccessException e) {
            throw unavailable("put", key, e);
        }
    }

    @Override
    public VersionedItem putIfAbsent(ItemKey key, String payload) {
        List<VersionedItem> inserted;
        try {
            inserted = jdbcTemplate.query(
                "INSERT INTO kv_items (record_family, partition_key, sort_key, payload, version, updated_at) " +
                "VALUES (?, ?, ?, ?, 1, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (record_family, partition_key, sort_key) DO NOTHING " +
                "RETURNING record_family, partition_key, sort_key, payload, version, updated_at",
                itemRowMapper(),
                key.getFamily(), key.getPartitionKey(), key.getSortKey(), payload
            );
        } catch (DataAccessException e) {
            throw unavailable("putIfAbsent", key, e);
        }
        if (inserted.isEmpty()) {
            throw new ItemAlreadyExistsException(key);
        }
        return inserted.get(0);
    }

    @Override
    public VersionedItem updateIfVersion(ItemKey key, String payload, long expectedVersion) {
        List<VersionedItem> updated;
        try {
            updated = jdbcTemplate.query(
                "UPDATE kv_items SET payload = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
                "WHERE record_family = ? AND partition_key = ? AND sort_key = ? AND version = ? " +
                "RETURNING record_family, partition_key, sort_key, payload, version, updated_at",
                itemRowMapper(),
                payload, key.getFamily(), key.getPartitionKey(), key.getSortKey(), expectedVersion
            );
        } catch (DataAccessException e) {
            throw unavailable("updateIfVersion", key, e);
        }
        if (updated.isEmpty()) {
            throw new VersionConflictException(key, expectedVersion);
        }
        return updated.get(0);
    }

    /**
     * The returned stream reads rows as it is consumed; a failure while reading
     * is reported as {@link StoreUnavailableException} like any other call.
     */
    @Override
    public Stream<VersionedItem> queryByPartition(String family, String partitionKey) {
        Stream<VersionedItem> rows;
        try {
            rows = jdbcTemplate.queryForStream(
                SELECT_COLUMNS + "WHERE record_family = ? AND partition_key = ? ORDER BY sort_key",
                itemRowMapper(),
                family, partitionKey
            );
        } catch (DataAccessException e) {
            throw queryFailed(family, partitionKey, e);
        }
        Iterator<VersionedItem> iterator = rows.iterator();
        Iterator<VersionedItem> translating = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return iterator.hasNext();
                } catch (DataAccessException e) {
                    throw queryFailed(family, partitionKey, e);
                }
            }

            @Override
            public VersionedItem next() {
                try {
                    return iterator.next();
                } catch (DataAccessException e) {
                    throw queryFailed(family, partitionKey, e);
                }
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(translating, Spliterator.ORDERED), false)
            .onClose(rows::close);
    }

    @Override
    public boolean isReachable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Store health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private StoreUnavailableException unavailable(String operation, ItemKey key, DataAccessException e) {
        log.error("Store {} failed for {}: {}", operation, key, e.getMessage());
        return new StoreUnavailableException(
            String.format("Store %s failed for %s", operation, key), e);
    }

    private StoreUnavailableException queryFailed(String family, String partitionKey, DataAccessException e) {
        log.error("Store query failed for partition {}/{}: {}", family, partitionKey, e.getMessage());
        return new StoreUnavailableException(
            String.format("Store query failed for partition %s/%s", family, partitionKey), e);
    }

    private RowMapper<VersionedItem> itemRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new VersionedItem(
                ItemKey.of(rs.getString("record_family"), rs.getString("partition_key"), rs.getString("sort_key")),
                rs.getString("payload"),
                rs.getLong("version"),
                updatedAt != null ? updatedAt.toInstant() : null
            );
        };
    }
}
