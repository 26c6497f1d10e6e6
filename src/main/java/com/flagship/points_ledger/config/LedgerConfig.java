package com.flagship.points_ledger.config;

import com.flagship.points_ledger.ledger.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Ledger retry configuration.
 *
 * Configures:
 * - points.ledger.max-attempts: conditional-update attempts per operation
 * - points.ledger.backoff-base-ms / backoff-cap-ms: randomized backoff bounds
 */
@Configuration
public class LedgerConfig {

    @Value("${points.ledger.max-attempts:5}")
    private int maxAttempts;

    @Value("${points.ledger.backoff-base-ms:10}")
    private long backoffBaseMs;

    @Value("${points.ledger.backoff-cap-ms:250}")
    private long backoffCapMs;

    @Bean
    public RetryPolicy ledgerRetryPolicy() {
        return RetryPolicy.of(maxAttempts, Duration.ofMillis(backoffBaseMs), Duration.ofMillis(backoffCapMs));
    }
}
