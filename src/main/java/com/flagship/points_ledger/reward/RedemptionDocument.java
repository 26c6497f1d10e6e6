package com.flagship.points_ledger.reward;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored form of a {@link RedemptionRecord}, also used for the cached copy in Redis.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RedemptionDocument {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("reward_id")
    private String rewardId;

    @JsonProperty("reward_title")
    private String rewardTitle;

    @JsonProperty("points_spent")
    private long pointsSpent;

    @JsonProperty("balance_after")
    private long balanceAfter;

    @JsonProperty("redeemed_at")
    private Instant redeemedAt;

    public static RedemptionDocument fromDomain(RedemptionRecord record) {
        return new RedemptionDocument(
            record.getUserId(),
            record.getRequestId(),
            record.getRewardId(),
            record.getRewardTitle(),
            record.getPointsSpent(),
            record.getBalanceAfter(),
            record.getRedeemedAt()
        );
    }

    public RedemptionRecord toDomain() {
        return new RedemptionRecord(userId, requestId, rewardId, rewardTitle, pointsSpent, balanceAfter, redeemedAt);
    }
}
