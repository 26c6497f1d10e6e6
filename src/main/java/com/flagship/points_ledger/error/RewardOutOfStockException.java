package com.flagship.points_ledger.error;

import lombok.Getter;

@Getter
public class RewardOutOfStockException extends PointsException {

    private final String rewardId;

    public RewardOutOfStockException(String rewardId) {
        super(FailureKind.BUSINESS_RULE, "Reward is out of stock: " + rewardId);
        this.rewardId = rewardId;
    }
}
