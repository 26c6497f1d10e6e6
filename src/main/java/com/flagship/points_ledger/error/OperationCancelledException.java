package com.flagship.points_ledger.error;

/**
 * The calling thread was interrupted between store calls. Any store call
 * already dispatched completed atomically; no further attempts were made.
 */
public class OperationCancelledException extends PointsException {

    public OperationCancelledException(String message) {
        super(FailureKind.TRANSIENT, message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT, message, cause);
    }
}
