package com.flagship.points_ledger.ledger;

import com.flagship.points_ledger.error.InsufficientBalanceException;
import com.flagship.points_ledger.error.OperationCancelledException;
import com.flagship.points_ledger.error.RetryExhaustedException;
import com.flagship.points_ledger.error.StoreUnavailableException;
import com.flagship.points_ledger.observability.PointsMetrics;
import com.flagship.points_ledger.store.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns point balance mutation.
 *
 * This service enforces the core invariants:
 * 1. A balance is never negative
 * 2. Each idempotency key changes a balance at most once
 * 3. Concurrent writers are serialized by version-checked conditional updates,
 *    never by locks, so any number of stateless replicas can run this code
 *
 * Each credit or debit runs a read / compute / conditional-update loop. A lost
 * version race re-reads and retries with randomized backoff until the attempt
 * ceiling is reached, then fails with {@link RetryExhaustedException}.
 */
@Service
@Slf4j
public class PointLedger {

    private final BalanceRepository balances;
    private final LedgerOperationRepository operations;
    private final RetryPolicy retryPolicy;
    private final PointsMetrics metrics;
    private final int recentOperationsLimit;

    public PointLedger(BalanceRepository balances,
                       LedgerOperationRepository operations,
                       RetryPolicy retryPolicy,
                       PointsMetrics metrics,
                       @Value("${points.ledger.recent-operations-limit:128}") int recentOperationsLimit) {
        if (recentOperationsLimit < 1) {
            throw new IllegalArgumentException("recentOperationsLimit must be at least 1");
        }
        this.balances = balances;
        this.operations = operations;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.recentOperationsLimit = recentOperationsLimit;
    }

    /**
     * Adds points to a user's balance.
     *
     * Replaying an idempotency key that already landed returns the current
     * balance unchanged.
     *
     * @throws RetryExhaustedException if every attempt lost a version race
     */
    public LedgerResult credit(String userId, long amount, String idempotencyKey) {
        return apply(userId, OperationType.CREDIT, amount, idempotencyKey);
    }

    /**
     * Removes points from a user's balance.
     *
     * Replaying an idempotency key that already landed returns the balance
     * recorded when it was first applied.
     *
     * @throws InsufficientBalanceException if the balance is lower than {@code amount}; never retried
     * @throws RetryExhaustedException if every attempt lost a version race
     */
    public LedgerResult debit(String userId, long amount, String idempotencyKey) {
        return apply(userId, OperationType.DEBIT, amount, idempotencyKey);
    }

    /**
     * Current balance; 0 for a user who never had a ledger operation.
     */
    public long getBalance(String userId) {
        requireUserId(userId);
        return balances.find(userId).map(PointBalance::getBalance).orElse(0L);
    }

    /**
     * Looks up an operation that already landed under {@code idempotencyKey},
     * checking the balance's recent operations first and then the side marker.
     */
    public Optional<AppliedOperation> findApplied(String userId, String idempotencyKey) {
        requireUserId(userId);
        Optional<AppliedOperation> recent = balances.find(userId)
            .flatMap(balance -> balance.findApplied(idempotencyKey));
        if (recent.isPresent()) {
            return recent;
        }
        return operations.find(userId, idempotencyKey);
    }

    public List<AppliedOperation> getOperations(String userId) {
        requireUserId(userId);
        return operations.findByUser(userId);
    }

    private LedgerResult apply(String userId, OperationType type, long amount, String idempotencyKey) {
        requireUserId(userId);
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        VersionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            ensureNotCancelled(userId, type);
            PointBalance current = balances.findOrCreate(userId);

            Optional<LedgerResult> replay = findReplay(current, type, idempotencyKey, attempt == 1);
            if (replay.isPresent()) {
                return replay.get();
            }

            AppliedOperation operation = new AppliedOperation(
                idempotencyKey, type, amount, computeBalance(current, type, amount), Instant.now());
            PointBalance next = current.apply(operation, recentOperationsLimit);

            ensureNotCancelled(userId, type);
            PointBalance stored;
            try {
                stored = balances.update(next, current.getVersion());
            } catch (VersionConflictException e) {
                lastConflict = e;
                metrics.recordConflict();
                log.debug("{} for user {} lost version race at version {} (attempt {}/{})",
                        type, userId, current.getVersion(), attempt, retryPolicy.getMaxAttempts());
                if (attempt < retryPolicy.getMaxAttempts()) {
                    backoff(userId, type, attempt);
                }
                continue;
            }

            recordMarker(userId, operation);
            metrics.recordLedgerOperation(type.name(), "applied");
            log.info("{} of {} applied for user {}: balance={}, key={}",
                    type, amount, userId, stored.getBalance(), idempotencyKey);
            return new LedgerResult(userId, amount, stored.getBalance(), false);
        }

        metrics.recordRetryExhausted();
        log.warn("{} of {} for user {} gave up after {} attempts, key={}",
                type, amount, userId, retryPolicy.getMaxAttempts(), idempotencyKey);
        throw new RetryExhaustedException(userId, retryPolicy.getMaxAttempts(), lastConflict);
    }

    /**
     * Detects an idempotency key that already landed. The embedded recent list is
     * checked on every attempt; the side marker only on the first, since any key
     * applied while this call is running shows up in the recent list.
     */
    private Optional<LedgerResult> findReplay(PointBalance current, OperationType type,
                                              String idempotencyKey, boolean checkMarker) {
        Optional<AppliedOperation> applied = current.findApplied(idempotencyKey);
        if (applied.isPresent()) {
            // heals a marker lost between the balance update and the marker write
            recordMarker(current.getUserId(), applied.get());
        } else if (checkMarker) {
            applied = operations.find(current.getUserId(), idempotencyKey);
        }
        if (applied.isEmpty()) {
            return Optional.empty();
        }

        AppliedOperation previous = applied.get();
        if (previous.getType() != type) {
            throw new IllegalArgumentException(String.format(
                "Idempotency key %s was already used for a %s", idempotencyKey, previous.getType()));
        }
        metrics.recordLedgerOperation(type.name(), "replayed");
        log.info("{} replay detected for user {}, key={}", type, current.getUserId(), idempotencyKey);

        long balance = type == OperationType.DEBIT ? previous.getResultingBalance() : current.getBalance();
        return Optional.of(new LedgerResult(current.getUserId(), previous.getAmount(), balance, true));
    }

    private long computeBalance(PointBalance current, OperationType type, long amount) {
        if (type == OperationType.CREDIT) {
            try {
                return Math.addExact(current.getBalance(), amount);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(
                    "Credit of " + amount + " would overflow the balance of user " + current.getUserId(), e);
            }
        }
        if (current.getBalance() < amount) {
            metrics.recordLedgerOperation(type.name(), "insufficient_balance");
            throw new InsufficientBalanceException(current.getUserId(), current.getBalance(), amount);
        }
        return current.getBalance() - amount;
    }

    /**
     * The balance record is authoritative; a failed marker write only narrows the
     * replay window to the recent-operations list, so it is logged and not raised.
     */
    private void recordMarker(String userId, AppliedOperation operation) {
        try {
            operations.record(userId, operation);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to record ledger operation marker {} for user {}: {}",
                    operation.getIdempotencyKey(), userId, e.getMessage());
        }
    }

    private void backoff(String userId, OperationType type, int attempt) {
        try {
            retryPolicy.pause(attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                type + " for user " + userId + " cancelled during backoff", e);
        }
    }

    private static void ensureNotCancelled(String userId, OperationType type) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException(type + " for user " + userId + " cancelled");
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
    }
}
