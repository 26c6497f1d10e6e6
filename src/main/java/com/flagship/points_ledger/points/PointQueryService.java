package com.flagship.points_ledger.points;

import com.flagship.points_ledger.achievement.AchievementRecord;
import com.flagship.points_ledger.achievement.AchievementRepository;
import com.flagship.points_ledger.ledger.AppliedOperation;
import com.flagship.points_ledger.ledger.PointLedger;
import com.flagship.points_ledger.reward.RedemptionRecord;
import com.flagship.points_ledger.reward.RedemptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only views over a user's points.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PointQueryService {

    private final PointLedger pointLedger;
    private final AchievementRepository achievements;
    private final RedemptionRepository redemptions;

    public long getBalance(String userId) {
        return pointLedger.getBalance(userId);
    }

    public List<AppliedOperation> getOperationHistory(String userId) {
        return pointLedger.getOperations(userId);
    }

    /**
     * Compares credited achievements and recorded redemptions with the balance.
     *
     * A non-zero difference while no operation is running means an achievement
     * is still PENDING after its credit landed (negative) or a debit landed
     * without its redemption record (positive). Retrying the original request,
     * or reconciling achievements, repairs either.
     */
    public PointSummary summarize(String userId) {
        requireUserId(userId);

        List<AchievementRecord> credited = achievements.findByUser(userId).stream()
            .filter(AchievementRecord::isCredited)
            .toList();
        long creditedTotal = credited.stream().mapToLong(AchievementRecord::getPoints).sum();
        long redeemedTotal = redemptions.findByUser(userId).stream()
            .mapToLong(RedemptionRecord::getPointsSpent)
            .sum();
        long balance = pointLedger.getBalance(userId);
        long difference = creditedTotal - redeemedTotal - balance;

        if (difference != 0) {
            log.warn("Points summary for user {} is off by {}: credited={}, redeemed={}, balance={}",
                userId, difference, creditedTotal, redeemedTotal, balance);
        }
        return new PointSummary(userId, credited.size(), creditedTotal, redeemedTotal, balance, difference);
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
    }
}
