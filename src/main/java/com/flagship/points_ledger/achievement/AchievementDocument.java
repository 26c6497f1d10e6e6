package com.flagship.points_ledger.achievement;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored form of an {@link AchievementRecord}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AchievementDocument {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("achievement_id")
    private String achievementId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("points")
    private long points;

    @JsonProperty("status")
    private AchievementStatus status;

    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("credited_at")
    private Instant creditedAt;

    public static AchievementDocument fromDomain(AchievementRecord record) {
        return new AchievementDocument(
            record.getUserId(),
            record.getAchievementId(),
            record.getTitle(),
            record.getPoints(),
            record.getStatus(),
            record.getIdempotencyKey(),
            record.getCreatedAt(),
            record.getCreditedAt()
        );
    }

    public AchievementRecord toDomain(long version) {
        return new AchievementRecord(
            userId, achievementId, title, points, status, idempotencyKey, createdAt, creditedAt, version);
    }
}
