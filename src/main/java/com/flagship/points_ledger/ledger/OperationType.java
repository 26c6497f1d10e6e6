package com.flagship.points_ledger.ledger;

/**
 * Direction of a balance mutation.
 */
public enum OperationType {
    CREDIT,
    DEBIT
}
