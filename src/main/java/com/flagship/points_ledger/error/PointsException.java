package com.flagship.points_ledger.error;

import lombok.Getter;

/**
 * Base class of every failure the points core surfaces to its callers.
 */
@Getter
public abstract class PointsException extends RuntimeException {

    private final FailureKind kind;

    protected PointsException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PointsException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
