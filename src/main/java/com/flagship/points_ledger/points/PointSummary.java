package com.flagship.points_ledger.points;

import lombok.Value;

/**
 * Conservation check for one user: points credited by achievements minus
 * points spent on redemptions should equal the balance.
 *
 * {@code difference} is {@code creditedTotal - redeemedTotal - balance}; it is 0
 * when no operation is in flight and nothing was lost.
 */
@Value
public class PointSummary {
    String userId;
    int creditedAchievements;
    long creditedTotal;
    long redeemedTotal;
    long balance;
    long difference;

    public boolean isConsistent() {
        return difference == 0;
    }
}
