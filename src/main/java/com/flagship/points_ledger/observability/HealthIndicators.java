package com.flagship.points_ledger.observability;

import com.flagship.points_ledger.store.KeyValueStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the points ledger.
 *
 * The store is required to serve any request. Redis only backs the redemption
 * replay cache, so losing it degrades the service rather than taking it down.
 */
public class HealthIndicators {

    @Component("storeHealth")
    public static class StoreHealthIndicator implements HealthIndicator {

        private final KeyValueStore store;

        public StoreHealthIndicator(KeyValueStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                return store.isReachable()
                        ? Health.up().build()
                        : Health.down().withDetail("error", "Store did not answer").build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    @Component("redemptionCacheHealth")
    public static class RedemptionCacheHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Redemptions fall back to the store for replay detection";

        private final StringRedisTemplate redisTemplate;

        public RedemptionCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up().withDetail("response", result).build();
                    }
                    return Health.status("DEGRADED")
                            .withDetail("response", result != null ? result : "null")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
