package com.flagship.points_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * A balance mutation that has landed, remembered under its idempotency key
 * together with the balance it produced.
 */
@Value
public class AppliedOperation {
    String idempotencyKey;
    OperationType type;
    long amount;
    long resultingBalance;
    Instant appliedAt;
}
