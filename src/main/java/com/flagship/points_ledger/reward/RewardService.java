package com.flagship.points_ledger.reward;

import com.flagship.points_ledger.catalog.RewardCatalogEntry;
import com.flagship.points_ledger.catalog.RewardCatalogRepository;
import com.flagship.points_ledger.error.InsufficientBalanceException;
import com.flagship.points_ledger.error.RewardNotFoundException;
import com.flagship.points_ledger.error.RewardOutOfStockException;
import com.flagship.points_ledger.ledger.AppliedOperation;
import com.flagship.points_ledger.ledger.IdempotencyKeys;
import com.flagship.points_ledger.ledger.LedgerResult;
import com.flagship.points_ledger.ledger.PointLedger;
import com.flagship.points_ledger.observability.CorrelationContext;
import com.flagship.points_ledger.observability.PointsMetrics;
import com.flagship.points_ledger.store.ItemAlreadyExistsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redeems points for catalog rewards.
 *
 * A redemption is identified by the caller's request ID. Retrying a request
 * with the same ID debits at most once and returns the same record:
 * 1. A request already recorded is answered from the record (Redis, then the store)
 * 2. The debit is keyed by user and request ID, so a repeated debit is a replay;
 *    a request whose debit already landed is recorded with the amount debited
 * 3. The record is created with a conditional put; a lost race returns the winner's record
 *
 * The balance can never go negative; an unaffordable reward fails with
 * {@link InsufficientBalanceException} and changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardService {

    private final RewardCatalogRepository catalog;
    private final RedemptionRepository redemptions;
    private final RedemptionReplayCache replayCache;
    private final PointLedger pointLedger;
    private final PointsMetrics metrics;

    /**
     * Redeems a reward for a user.
     *
     * @param requestId caller-chosen ID; repeat it to retry the same redemption safely
     * @throws RewardNotFoundException if the reward is not in the catalog
     * @throws RewardOutOfStockException if the reward has a stock count and none is left
     * @throws InsufficientBalanceException if the user cannot afford the reward
     * @throws com.flagship.points_ledger.error.RetryExhaustedException if the balance stayed contended
     */
    public RedemptionResult redeem(String userId, String rewardId, String requestId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (rewardId == null || rewardId.isBlank()) {
            throw new IllegalArgumentException("Reward ID is required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("Request ID is required");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);
        log.info("Redemption requested: rewardId={}, requestId={}", rewardId, requestId);

        try {
            Optional<RedemptionRecord> existing = replayCache.lookup(userId, requestId);
            if (existing.isPresent()) {
                return replay(existing.get(), rewardId);
            }

            RewardCatalogEntry reward = catalog.find(rewardId)
                .orElseThrow(() -> new RewardNotFoundException(rewardId));
            LedgerResult debit = debitOnce(userId, requestId, reward);

            RedemptionRecord record = new RedemptionRecord(
                userId, requestId, reward.getRewardId(), reward.getTitle(),
                debit.getAmount(), debit.getBalance(), Instant.now());
            try {
                redemptions.create(record);
            } catch (ItemAlreadyExistsException e) {
                RedemptionRecord winner = redemptions.find(userId, requestId)
                    .orElseThrow(() -> new IllegalStateException(
                        "Redemption " + requestId + " exists but could not be read for user " + userId, e));
                replayCache.remember(winner);
                return replay(winner, rewardId);
            }
            replayCache.remember(record);

            metrics.recordRedemption("success");
            log.info("Reward {} redeemed: pointsSpent={}, balance={}, debitReplayed={}",
                rewardId, debit.getAmount(), debit.getBalance(), debit.isReplayed());
            return new RedemptionResult(record, false);

        } catch (InsufficientBalanceException e) {
            metrics.recordRedemption("insufficient_balance");
            log.info("Redemption of {} rejected: balance={}, cost={}", rewardId, e.getBalance(), e.getRequested());
            throw e;
        } catch (RewardNotFoundException e) {
            metrics.recordRedemption("not_found");
            log.info("Redemption rejected, reward not found: {}", rewardId);
            throw e;
        } catch (RewardOutOfStockException e) {
            metrics.recordRedemption("out_of_stock");
            log.info("Redemption rejected, reward out of stock: {}", rewardId);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordRedemption("error");
            log.error("Redemption of {} failed: {}", rewardId, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("redeem", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    /**
     * Lists a user's redemptions, oldest first.
     */
    public List<RedemptionRecord> listRedemptionHistory(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        return redemptions.findByUser(userId);
    }

    /**
     * Debits the reward's cost, unless an earlier attempt of this request already
     * debited and stopped before writing its record. That debit is replayed as
     * it landed: its amount is kept and the stock gate is not applied again.
     */
    private LedgerResult debitOnce(String userId, String requestId, RewardCatalogEntry reward) {
        String debitKey = IdempotencyKeys.forRedemption(userId, requestId);
        Optional<AppliedOperation> landed = pointLedger.findApplied(userId, debitKey);
        if (landed.isPresent()) {
            log.warn("Request {} was debited {} without a redemption record, completing it",
                requestId, landed.get().getAmount());
            return pointLedger.debit(userId, landed.get().getAmount(), debitKey);
        }
        if (!reward.isInStock()) {
            throw new RewardOutOfStockException(reward.getRewardId());
        }
        return pointLedger.debit(userId, reward.getCost(), debitKey);
    }

    private RedemptionResult replay(RedemptionRecord record, String requestedRewardId) {
        if (!record.getRewardId().equals(requestedRewardId)) {
            throw new IllegalArgumentException(String.format(
                "Request ID %s was already used to redeem reward %s",
                record.getRequestId(), record.getRewardId()));
        }
        metrics.recordRedemption("replayed");
        log.info("Redemption replay detected: requestId={}, rewardId={}", record.getRequestId(), record.getRewardId());
        return new RedemptionResult(record, true);
    }
}
