package com.flagship.points_ledger.reward;

import com.flagship.points_ledger.store.DocumentMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Looks up redemptions that were already recorded for a request ID.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the store (authoritative)
 * 3. Cache store hits in Redis for future lookups
 *
 * Redis is never a correctness gate: any Redis failure falls through to the
 * store, and a stale or missing cache entry only costs a store read.
 */
@Service
@Slf4j
public class RedemptionReplayCache {

    private static final String REDIS_KEY_PREFIX = "points:redemption:";

    private final RedemptionRepository redemptions;
    private final DocumentMapper documentMapper;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public RedemptionReplayCache(RedemptionRepository redemptions,
                                 DocumentMapper documentMapper,
                                 Optional<StringRedisTemplate> redisTemplate,
                                 @Value("${points.redemption-cache.ttl:P7D}") Duration ttl) {
        this.redemptions = redemptions;
        this.documentMapper = documentMapper;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * Finds the redemption already recorded for this request, if any.
     */
    public Optional<RedemptionRecord> lookup(String userId, String requestId) {
        String redisKey = redisKey(userId, requestId);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Redemption {} found in Redis", requestId);
                    return Optional.of(documentMapper.read(cached, RedemptionDocument.class).toDomain());
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for redemption {}. Falling back to store. Error: {}",
                        requestId, e.getMessage());
            }
        }

        Optional<RedemptionRecord> stored = redemptions.find(userId, requestId);
        stored.ifPresent(record -> {
            log.debug("Redemption {} found in store", requestId);
            remember(record);
        });
        return stored;
    }

    /**
     * Caches a recorded redemption. Best effort; failures are logged only.
     */
    public void remember(RedemptionRecord record) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(
                    redisKey(record.getUserId(), record.getRequestId()),
                    documentMapper.write(RedemptionDocument.fromDomain(record)),
                    ttl);
        } catch (Exception e) {
            log.warn("Failed to cache redemption {} in Redis. Error: {}", record.getRequestId(), e.getMessage());
        }
    }

    private static String redisKey(String userId, String requestId) {
        return REDIS_KEY_PREFIX + userId + ":" + requestId;
    }
}
