package com.flagship.points_ledger.reward;

import lombok.Value;

import java.time.Instant;

/**
 * A completed redemption. At most one exists per (userId, requestId).
 */
@Value
public class RedemptionRecord {
    String userId;
    String requestId;
    String rewardId;
    String rewardTitle;
    long pointsSpent;
    long balanceAfter;
    Instant redeemedAt;
}
