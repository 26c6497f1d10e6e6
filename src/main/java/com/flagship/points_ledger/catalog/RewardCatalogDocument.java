package com.flagship.points_ledger.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RewardCatalogDocument {

    @JsonProperty("reward_id")
    private String rewardId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("cost")
    private long cost;

    @JsonProperty("stock")
    private Long stock;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static RewardCatalogDocument fromDomain(RewardCatalogEntry entry) {
        return new RewardCatalogDocument(
            entry.getRewardId(),
            entry.getTitle(),
            entry.getDescription(),
            entry.getCost(),
            entry.getStock(),
            entry.getCreatedAt(),
            entry.getUpdatedAt()
        );
    }

    public RewardCatalogEntry toDomain() {
        return new RewardCatalogEntry(rewardId, title, description, cost, stock, createdAt, updatedAt);
    }
}
