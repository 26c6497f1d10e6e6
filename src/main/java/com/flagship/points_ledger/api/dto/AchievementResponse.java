package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.achievement.AchievementRecord;
import com.flagship.points_ledger.achievement.AchievementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AchievementResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("achievement_id")
    String achievementId;

    @JsonProperty("title")
    String title;

    @JsonProperty("points")
    long points;

    @JsonProperty("status")
    AchievementStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("credited_at")
    Instant creditedAt;

    public static AchievementResponse from(AchievementRecord record) {
        return AchievementResponse.builder()
            .userId(record.getUserId())
            .achievementId(record.getAchievementId())
            .title(record.getTitle())
            .points(record.getPoints())
            .status(record.getStatus())
            .createdAt(record.getCreatedAt())
            .creditedAt(record.getCreditedAt())
            .build();
    }
}
