package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for creating or replacing a catalog reward. Omit {@code stock}
 * for an unlimited reward.
 */
@Value
public class SaveRewardRequest {

    @NotBlank(message = "Title is required")
    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Cost is required")
    @Min(value = 1, message = "Cost must be greater than 0")
    @JsonProperty("cost")
    Long cost;

    @Min(value = 0, message = "Stock cannot be negative")
    @JsonProperty("stock")
    Long stock;
}
