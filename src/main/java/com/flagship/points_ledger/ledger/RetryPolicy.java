package com.flagship.points_ledger.ledger;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry budget for optimistic-concurrency loops, with exponential,
 * capped, full-jitter backoff between attempts.
 */
@Getter
public class RetryPolicy {

    /**
     * Blocks the calling thread. Replaced in tests to avoid real sleeps.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration backoffCap;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffCap, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffBase.isNegative() || backoffCap.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
        this.backoffCap = backoffCap;
        this.sleeper = sleeper;
    }

    public static RetryPolicy of(int maxAttempts, Duration backoffBase, Duration backoffCap) {
        return new RetryPolicy(maxAttempts, backoffBase, backoffCap, duration -> Thread.sleep(duration.toMillis()));
    }

    /**
     * Upper bound of the backoff after the given (1-based) failed attempt:
     * {@code min(cap, base * 2^(attempt-1))}.
     */
    public Duration ceilingFor(int attempt) {
        long baseMs = backoffBase.toMillis();
        long capMs = backoffCap.toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long exponential = baseMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMs << shift;
        return Duration.ofMillis(Math.min(capMs, exponential));
    }

    /**
     * Picks a random delay in {@code [0, ceilingFor(attempt)]}.
     */
    public Duration backoffFor(int attempt) {
        long ceiling = ceilingFor(attempt).toMillis();
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(ceiling + 1));
    }

    public void pause(int attempt) throws InterruptedException {
        Duration delay = backoffFor(attempt);
        if (!delay.isZero()) {
            sleeper.sleep(delay);
        }
    }
}
