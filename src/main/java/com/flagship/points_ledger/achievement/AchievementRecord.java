package com.flagship.points_ledger.achievement;

import com.flagship.points_ledger.ledger.IdempotencyKeys;
import lombok.Value;

import java.time.Instant;

/**
 * A user's completion of one achievement. At most one record exists per
 * (userId, achievementId).
 *
 * State changes are immutable: {@link #markCredited()} returns a new record.
 */
@Value
public class AchievementRecord {
    String userId;
    String achievementId;
    String title;
    long points;
    AchievementStatus status;
    String idempotencyKey;
    Instant createdAt;
    Instant creditedAt;
    long version;

    /**
     * Creates a new completion in PENDING status. Not yet stored (version 0).
     */
    public static AchievementRecord pending(String userId, String achievementId, long points) {
        return pending(userId, achievementId, null, points);
    }

    /**
     * Same as {@link #pending(String, String, long)} with a display title, which may be null.
     */
    public static AchievementRecord pending(String userId, String achievementId, String title, long points) {
        return new AchievementRecord(
            userId,
            achievementId,
            title,
            points,
            AchievementStatus.PENDING,
            IdempotencyKeys.forAchievement(userId, achievementId),
            Instant.now(),
            null,
            0L
        );
    }

    /**
     * Transitions the record to CREDITED.
     *
     * @throws IllegalStateException if the record is already CREDITED
     */
    public AchievementRecord markCredited() {
        if (status != AchievementStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot credit achievement %s for user %s in %s status", achievementId, userId, status));
        }
        return new AchievementRecord(
            userId, achievementId, title, points, AchievementStatus.CREDITED,
            idempotencyKey, createdAt, Instant.now(), version);
    }

    public boolean isCredited() {
        return status == AchievementStatus.CREDITED;
    }
}
