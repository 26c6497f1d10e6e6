package com.flagship.points_ledger.error;

/**
 * The backing store could not be reached or failed to execute a request.
 */
public class StoreUnavailableException extends PointsException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT, message, cause);
    }
}
