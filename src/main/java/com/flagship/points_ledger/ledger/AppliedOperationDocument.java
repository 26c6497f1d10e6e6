package com.flagship.points_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored form of an {@link AppliedOperation}. Embedded in balance documents and
 * also written on its own as the ledger operation marker.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AppliedOperationDocument {

    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    @JsonProperty("type")
    private OperationType type;

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("resulting_balance")
    private long resultingBalance;

    @JsonProperty("applied_at")
    private Instant appliedAt;

    public static AppliedOperationDocument fromDomain(AppliedOperation operation) {
        return new AppliedOperationDocument(
            operation.getIdempotencyKey(),
            operation.getType(),
            operation.getAmount(),
            operation.getResultingBalance(),
            operation.getAppliedAt()
        );
    }

    public AppliedOperation toDomain() {
        return new AppliedOperation(idempotencyKey, type, amount, resultingBalance, appliedAt);
    }
}
