package com.flagship.points_ledger.reward;

import lombok.Value;

/**
 * Outcome of a redemption. {@code replayed} is true when the request had
 * already been recorded and nothing was debited by this call.
 */
@Value
public class RedemptionResult {
    RedemptionRecord record;
    boolean replayed;
}
