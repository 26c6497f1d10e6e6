package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CompleteAchievementRequest {

    @NotNull(message = "Points are required")
    @Min(value = 1, message = "Points must be greater than 0")
    @JsonProperty("points")
    Long points;

    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;
}
