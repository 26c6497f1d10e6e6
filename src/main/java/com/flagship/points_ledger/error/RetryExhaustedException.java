package com.flagship.points_ledger.error;

import lombok.Getter;

/**
 * The ledger lost every optimistic-concurrency race it was allowed to retry.
 * The whole request can be retried by the caller.
 */
@Getter
public class RetryExhaustedException extends PointsException {

    private final String userId;
    private final int attempts;

    public RetryExhaustedException(String userId, int attempts, Throwable lastConflict) {
        super(FailureKind.TRANSIENT,
            String.format("Balance update for user %s did not converge after %d attempts", userId, attempts),
            lastConflict);
        this.userId = userId;
        this.attempts = attempts;
    }
}
