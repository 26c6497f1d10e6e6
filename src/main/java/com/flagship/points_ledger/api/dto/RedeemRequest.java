package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Request body for redeeming a reward. The request ID travels in the
 * Idempotency-Key header.
 */
@Value
public class RedeemRequest {

    @NotBlank(message = "Reward ID is required")
    @JsonProperty("reward_id")
    String rewardId;
}
