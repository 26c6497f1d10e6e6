package com.flagship.points_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a {@link PointBalance}. The version lives in the store's
 * item metadata, not in the document.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PointBalanceDocument {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("balance")
    private long balance;

    @JsonProperty("recent_operations")
    private List<AppliedOperationDocument> recentOperations = new ArrayList<>();

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static PointBalanceDocument fromDomain(PointBalance balance) {
        return new PointBalanceDocument(
            balance.getUserId(),
            balance.getBalance(),
            balance.getRecentOperations().stream()
                .map(AppliedOperationDocument::fromDomain)
                .toList(),
            balance.getUpdatedAt()
        );
    }

    public PointBalance toDomain(long version) {
        List<AppliedOperation> operations = recentOperations == null
            ? List.of()
            : recentOperations.stream().map(AppliedOperationDocument::toDomain).toList();
        return new PointBalance(userId, balance, version, operations, updatedAt);
    }
}
