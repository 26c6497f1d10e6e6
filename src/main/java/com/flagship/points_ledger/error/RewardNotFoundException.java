package com.flagship.points_ledger.error;

import lombok.Getter;

@Getter
public class RewardNotFoundException extends PointsException {

    private final String rewardId;

    public RewardNotFoundException(String rewardId) {
        super(FailureKind.NOT_FOUND, "Reward not found: " + rewardId);
        this.rewardId = rewardId;
    }
}
