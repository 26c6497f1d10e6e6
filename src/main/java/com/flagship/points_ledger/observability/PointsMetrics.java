package com.flagship.points_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger, achievement and redemption operations.
 *
 * Metrics exposed:
 * - points.ledger.operations{type,result}: credits and debits by outcome
 * - points.ledger.conflicts: conditional updates that lost a version race
 * - points.ledger.retry_exhausted: operations that gave up after the retry budget
 * - points.achievements{result}: achievement completions by outcome
 * - points.redemptions{result}: redemptions by outcome
 * - points.operation.latency{operation}: service operation latency
 */
@Component
public class PointsMetrics {

    private final MeterRegistry registry;

    private final Counter conflicts;
    private final Counter retryExhausted;

    public PointsMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.conflicts = Counter.builder("points.ledger.conflicts")
                .description("Conditional balance updates that lost a version race")
                .register(registry);

        this.retryExhausted = Counter.builder("points.ledger.retry_exhausted")
                .description("Ledger operations that exhausted their retry budget")
                .register(registry);
    }

    public void recordLedgerOperation(String type, String result) {
        registry.counter("points.ledger.operations",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordConflict() {
        conflicts.increment();
    }

    public void recordRetryExhausted() {
        retryExhausted.increment();
    }

    public void recordAchievement(String result) {
        registry.counter("points.achievements", "result", sanitizeTag(result)).increment();
    }

    public void recordRedemption(String result) {
        registry.counter("points.redemptions", "result", sanitizeTag(result)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("points.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
