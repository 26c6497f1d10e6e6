package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.achievement.AchievementCompletion;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for completing or reconciling an achievement.
 */
@Value
@Builder
public class AchievementCompletionResponse {

    @JsonProperty("status")
    AchievementCompletion.Outcome status;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("achievement")
    AchievementResponse achievement;

    public static AchievementCompletionResponse from(AchievementCompletion completion) {
        return AchievementCompletionResponse.builder()
            .status(completion.getOutcome())
            .balance(completion.getBalance())
            .achievement(AchievementResponse.from(completion.getRecord()))
            .build();
    }
}
