package com.flagship.points_ledger.observability;

import com.flagship.points_ledger.error.StoreUnavailableException;
import com.flagship.points_ledger.store.KeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthIndicatorsTest {

    @Test
    @DisplayName("Store health follows store reachability")
    void storeHealth() {
        KeyValueStore store = mock(KeyValueStore.class);
        HealthIndicators.StoreHealthIndicator indicator = new HealthIndicators.StoreHealthIndicator(store);

        when(store.isReachable()).thenReturn(true);
        assertEquals(Status.UP, indicator.health().getStatus());

        when(store.isReachable()).thenReturn(false);
        assertEquals(Status.DOWN, indicator.health().getStatus());

        when(store.isReachable()).thenThrow(new StoreUnavailableException("down", new RuntimeException()));
        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("Losing Redis degrades the service instead of taking it down")
    void redisOutageIsDegraded() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        RedisConnectionFactory connectionFactory = mock(RedisConnectionFactory.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(connectionFactory);
        when(connectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("refused"));

        HealthIndicators.RedemptionCacheHealthIndicator indicator =
            new HealthIndicators.RedemptionCacheHealthIndicator(redisTemplate);

        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }
}
