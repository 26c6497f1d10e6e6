package com.flagship.points_ledger.ledger;

import lombok.Value;

/**
 * Outcome of a credit or debit.
 *
 * {@code amount} is what the idempotency key moved when it first landed; on a
 * replay it can differ from the amount passed to the replaying call.
 * {@code replayed} is true when the idempotency key had already been applied
 * and no mutation happened on this call.
 */
@Value
public class LedgerResult {
    String userId;
    long amount;
    long balance;
    boolean replayed;
}
