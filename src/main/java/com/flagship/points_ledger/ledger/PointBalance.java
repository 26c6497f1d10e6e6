package com.flagship.points_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Domain model for a user's point balance.
 *
 * Key invariants:
 * - balance is never negative
 * - version is the store version the snapshot was read at (0 = not yet stored)
 * - recentOperations is ordered oldest first and bounded by the ledger's limit
 *
 * Instances are immutable; {@link #apply} returns the next snapshot.
 */
@Value
public class PointBalance {
    String userId;
    long balance;
    long version;
    List<AppliedOperation> recentOperations;
    Instant updatedAt;

    public PointBalance(String userId, long balance, long version,
                        List<AppliedOperation> recentOperations, Instant updatedAt) {
        if (balance < 0) {
            throw new IllegalStateException("Balance cannot be negative for user " + userId + ": " + balance);
        }
        this.userId = userId;
        this.balance = balance;
        this.version = version;
        this.recentOperations = List.copyOf(recentOperations);
        this.updatedAt = updatedAt;
    }

    /**
     * Creates the zero balance written on a user's first ledger operation.
     */
    public static PointBalance initial(String userId) {
        return new PointBalance(userId, 0L, 0L, List.of(), Instant.now());
    }

    public Optional<AppliedOperation> findApplied(String idempotencyKey) {
        return recentOperations.stream()
            .filter(op -> op.getIdempotencyKey().equals(idempotencyKey))
            .findFirst();
    }

    /**
     * Returns the snapshot after {@code operation}, keeping at most
     * {@code recentLimit} remembered operations.
     */
    public PointBalance apply(AppliedOperation operation, int recentLimit) {
        List<AppliedOperation> recent = new ArrayList<>(recentOperations);
        recent.add(operation);
        while (recent.size() > recentLimit) {
            recent.remove(0);
        }
        return new PointBalance(userId, operation.getResultingBalance(), version, recent, operation.getAppliedAt());
    }
}
