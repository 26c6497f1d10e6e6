package com.flagship.points_ledger.error;

/**
 * Classifies caller-visible failures so that callers can tell
 * "never retry" apart from "retry with backoff".
 */
public enum FailureKind {
    /**
     * A business rule rejected the request. Retrying the same request cannot succeed.
     */
    BUSINESS_RULE,

    /**
     * A referenced resource does not exist.
     */
    NOT_FOUND,

    /**
     * The request may succeed if retried later (contention, backend outage, cancellation).
     */
    TRANSIENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
