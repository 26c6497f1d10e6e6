package com.flagship.points_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.points_ledger.ledger.AppliedOperation;
import com.flagship.points_ledger.ledger.OperationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of a user's points history.
 */
@Value
@Builder
public class LedgerOperationResponse {

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("type")
    OperationType type;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("resulting_balance")
    long resultingBalance;

    @JsonProperty("applied_at")
    Instant appliedAt;

    public static LedgerOperationResponse from(AppliedOperation operation) {
        return LedgerOperationResponse.builder()
            .idempotencyKey(operation.getIdempotencyKey())
            .type(operation.getType())
            .amount(operation.getAmount())
            .resultingBalance(operation.getResultingBalance())
            .appliedAt(operation.getAppliedAt())
            .build();
    }
}
