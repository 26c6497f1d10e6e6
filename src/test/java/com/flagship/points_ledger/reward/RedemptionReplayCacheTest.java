package com.flagship.points_ledger.reward;

import com.flagship.points_ledger.store.InMemoryKeyValueStore;
import com.flagship.points_ledger.support.PointsTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Redis is a fast path only: misses and outages fall back to the store.
 */
class RedemptionReplayCacheTest {

    private static final Duration TTL = Duration.ofDays(7);

    private PointsTestContext context;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedemptionReplayCache cache;

    private final RedemptionRecord record = new RedemptionRecord(
        "user-1", "req-1", "mug", "Coffee mug", 80, 20, Instant.now().truncatedTo(ChronoUnit.MILLIS));

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        context = new PointsTestContext(new InMemoryKeyValueStore());
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new RedemptionReplayCache(context.redemptions, context.documentMapper, Optional.of(redisTemplate), TTL);
    }

    @Test
    @DisplayName("A Redis hit is answered without the store")
    void redisHitIsReturned() {
        when(valueOperations.get("points:redemption:user-1:req-1"))
            .thenReturn(context.documentMapper.write(RedemptionDocument.fromDomain(record)));

        assertEquals(Optional.of(record), cache.lookup("user-1", "req-1"));
        assertTrue(context.redemptions.find("user-1", "req-1").isEmpty());
    }

    @Test
    @DisplayName("A store hit is cached in Redis with the configured TTL")
    void storeHitIsCached() {
        context.redemptions.create(record);

        assertEquals(Optional.of(record), cache.lookup("user-1", "req-1"));
        verify(valueOperations).set(eq("points:redemption:user-1:req-1"), anyString(), eq(TTL));
    }

    @Test
    @DisplayName("Redis outages fall back to the store")
    void redisFailureFallsBackToStore() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        doThrow(new RedisConnectionFailureException("down"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        context.redemptions.create(record);

        assertEquals(Optional.of(record), cache.lookup("user-1", "req-1"));
        assertTrue(cache.lookup("user-1", "req-2").isEmpty());
    }

    @Test
    @DisplayName("Without Redis the store is the only source")
    void worksWithoutRedis() {
        RedemptionReplayCache storeOnly = new RedemptionReplayCache(
            context.redemptions, context.documentMapper, Optional.empty(), TTL);
        storeOnly.remember(record);
        assertTrue(storeOnly.lookup("user-1", "req-1").isEmpty());

        context.redemptions.create(record);
        assertEquals(Optional.of(record), storeOnly.lookup("user-1", "req-1"));
    }
}
