package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.points.PointSummary;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PointSummaryResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("credited_achievements")
    int creditedAchievements;

    @JsonProperty("credited_total")
    long creditedTotal;

    @JsonProperty("redeemed_total")
    long redeemedTotal;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("difference")
    long difference;

    @JsonProperty("consistent")
    boolean consistent;

    public static PointSummaryResponse from(PointSummary summary) {
        return PointSummaryResponse.builder()
            .userId(summary.getUserId())
            .creditedAchievements(summary.getCreditedAchievements())
            .creditedTotal(summary.getCreditedTotal())
            .redeemedTotal(summary.getRedeemedTotal())
            .balance(summary.getBalance())
            .difference(summary.getDifference())
            .consistent(summary.isConsistent())
            .build();
    }
}
