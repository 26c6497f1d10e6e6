package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.catalog.RewardCatalogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RewardResponse {

    @JsonProperty("reward_id")
    String rewardId;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("cost")
    long cost;

    @JsonProperty("stock")
    Long stock;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static RewardResponse from(RewardCatalogEntry entry) {
        return RewardResponse.builder()
            .rewardId(entry.getRewardId())
            .title(entry.getTitle())
            .description(entry.getDescription())
            .cost(entry.getCost())
            .stock(entry.getStock())
            .createdAt(entry.getCreatedAt())
            .updatedAt(entry.getUpdatedAt())
            .build();
    }
}
