package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balance")
    long balance;
}
