package com.flagship.points_ledger.error;

import lombok.Getter;

/**
 * Terminal rejection of a debit that would take the balance below zero.
 * No write was attempted.
 */
@Getter
public class InsufficientBalanceException extends PointsException {

    private final String userId;
    private final long balance;
    private final long requested;

    public InsufficientBalanceException(String userId, long balance, long requested) {
        super(FailureKind.BUSINESS_RULE,
            String.format("Insufficient points for user %s: balance=%d, requested=%d",
                userId, balance, requested));
        this.userId = userId;
        this.balance = balance;
        this.requested = requested;
    }
}
