package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.reward.RedemptionRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RedemptionResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("request_id")
    String requestId;

    @JsonProperty("reward_id")
    String rewardId;

    @JsonProperty("reward_title")
    String rewardTitle;

    @JsonProperty("points_spent")
    long pointsSpent;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("redeemed_at")
    Instant redeemedAt;

    public static RedemptionResponse from(RedemptionRecord record) {
        return RedemptionResponse.builder()
            .userId(record.getUserId())
            .requestId(record.getRequestId())
            .rewardId(record.getRewardId())
            .rewardTitle(record.getRewardTitle())
            .pointsSpent(record.getPointsSpent())
            .balanceAfter(record.getBalanceAfter())
            .redeemedAt(record.getRedeemedAt())
            .build();
    }
}
