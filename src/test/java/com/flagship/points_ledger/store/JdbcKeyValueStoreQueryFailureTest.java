package com.flagship.points_ledger.store;

import com.flagship.points_ledger.config.JacksonConfig;
import com.flagship.points_ledger.error.StoreUnavailableException;
import com.flagship.points_ledger.reward.RedemptionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Partition queries read rows lazily, so the connection can fail after the
 * query was issued. Those failures must surface as store outages too.
 */
class JdbcKeyValueStoreQueryFailureTest {

    @Test
    @DisplayName("A connection lost while rows are read surfaces as StoreUnavailableException")
    void failureWhileReadingIsTranslated() {
        FailingJdbcTemplate jdbcTemplate = new FailingJdbcTemplate(false);
        JdbcKeyValueStore store = new JdbcKeyValueStore(jdbcTemplate);

        StoreUnavailableException e;
        try (Stream<VersionedItem> items = store.queryByPartition("redemption", "user-1")) {
            e = assertThrows(StoreUnavailableException.class, items::toList);
        }

        assertTrue(e.isRetryable());
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
        assertTrue(jdbcTemplate.closed.get(), "Closing the stream must release the result set");
    }

    @Test
    @DisplayName("A failing query statement surfaces as StoreUnavailableException")
    void failureOnExecuteIsTranslated() {
        JdbcKeyValueStore store = new JdbcKeyValueStore(new FailingJdbcTemplate(true));

        assertThrows(StoreUnavailableException.class, () -> store.queryByPartition("redemption", "user-1"));
    }

    @Test
    @DisplayName("Repository listings report a mid-read failure as a store outage")
    void repositoryListingIsTranslated() {
        RedemptionRepository redemptions = new RedemptionRepository(
            new JdbcKeyValueStore(new FailingJdbcTemplate(false)),
            new DocumentMapper(new JacksonConfig().objectMapper()));

        assertThrows(StoreUnavailableException.class, () -> redemptions.findByUser("user-1"));
    }

    /**
     * Returns a stream whose first read fails, or fails the statement itself.
     */
    static class FailingJdbcTemplate extends JdbcTemplate {

        private final boolean failOnExecute;
        final AtomicBoolean closed = new AtomicBoolean();

        FailingJdbcTemplate(boolean failOnExecute) {
            this.failOnExecute = failOnExecute;
        }

        @Override
        public <T> Stream<T> queryForStream(String sql, RowMapper<T> rowMapper, Object... args) {
            if (failOnExecute) {
                throw new DataAccessResourceFailureException("connection refused");
            }
            Stream<T> rows = Stream.generate(() -> {
                throw new DataAccessResourceFailureException("connection reset");
            });
            return rows.onClose(() -> closed.set(true));
        }
    }
}
