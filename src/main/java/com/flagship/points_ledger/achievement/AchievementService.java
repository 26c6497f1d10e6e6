package com.flagship.points_ledger.achievement;

import com.flagship.points_ledger.ledger.LedgerResult;
import com.flagship.points_ledger.ledger.PointLedger;
import com.flagship.points_ledger.observability.CorrelationContext;
import com.flagship.points_ledger.observability.PointsMetrics;
import com.flagship.points_ledger.store.ItemAlreadyExistsException;
import com.flagship.points_ledger.store.VersionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Records achievement completions and credits their points exactly once.
 *
 * Completion is a three-step saga over independent records:
 * 1. Create the AchievementRecord in PENDING (conditional put; one per user and achievement)
 * 2. Credit the points through the {@link PointLedger} under a key derived from
 *    the user and achievement, so a repeated credit is a replay
 * 3. Mark the record CREDITED with a version-checked update
 *
 * A crash between any two steps leaves a PENDING record. Calling
 * {@link #completeAchievement} again, or {@link #reconcile}, resumes it without
 * double credit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AchievementService {

    private final AchievementRepository achievements;
    private final PointLedger pointLedger;
    private final PointsMetrics metrics;

    /**
     * Completes an achievement for a user and credits its points.
     *
     * @param pointsValue points to credit; ignored when resuming a PENDING record,
     *                    which keeps the value it was created with
     * @return COMPLETED if this call credited the points, ALREADY_COMPLETED if they were credited earlier
     */
    public AchievementCompletion completeAchievement(String userId, String achievementId, long pointsValue) {
        return completeAchievement(userId, achievementId, null, pointsValue);
    }

    /**
     * Completes an achievement with a display title. A blank title is stored as none;
     * like the points, the title of a record that already exists is kept.
     */
    public AchievementCompletion completeAchievement(String userId, String achievementId,
                                                     String title, long pointsValue) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (achievementId == null || achievementId.isBlank()) {
            throw new IllegalArgumentException("Achievement ID is required");
        }
        if (pointsValue <= 0) {
            throw new IllegalArgumentException("Achievement points must be positive");
        }

        String storedTitle = title == null || title.isBlank() ? null : title.strip();

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);
        try {
            AchievementRecord record;
            try {
                record = achievements.create(AchievementRecord.pending(userId, achievementId, storedTitle, pointsValue));
                log.info("Achievement {} recorded as PENDING: points={}", achievementId, pointsValue);
            } catch (ItemAlreadyExistsException e) {
                record = achievements.find(userId, achievementId)
                    .orElseThrow(() -> new IllegalStateException(
                        "Achievement " + achievementId + " exists but could not be read for user " + userId));

                if (record.isCredited()) {
                    metrics.recordAchievement("already_completed");
                    log.info("Achievement {} already credited", achievementId);
                    return new AchievementCompletion(record, AchievementCompletion.Outcome.ALREADY_COMPLETED,
                        pointLedger.getBalance(userId));
                }
                if (record.getPoints() != pointsValue) {
                    log.warn("Resuming PENDING achievement {} with stored points {} instead of {}",
                        achievementId, record.getPoints(), pointsValue);
                } else {
                    log.info("Resuming PENDING achievement {}", achievementId);
                }
            }

            AchievementCompletion completion = creditAndMark(record);
            metrics.recordAchievement("completed");
            return completion;

        } catch (RuntimeException e) {
            metrics.recordAchievement("error");
            log.error("Achievement {} completion failed: {}", achievementId, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("complete_achievement", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    /**
     * Re-drives every PENDING achievement of a user to CREDITED.
     *
     * Idempotent: records already CREDITED are skipped and a credit that already
     * landed is replayed, not applied twice.
     *
     * @return the completions this pass finished
     */
    public List<AchievementCompletion> reconcile(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);
        try {
            List<AchievementCompletion> resumed = new ArrayList<>();
            for (AchievementRecord record : achievements.findByUser(userId)) {
                if (record.isCredited()) {
                    continue;
                }
                log.info("Reconciling PENDING achievement {}", record.getAchievementId());
                resumed.add(creditAndMark(record));
                metrics.recordAchievement("reconciled");
            }
            log.info("Reconciliation finished: resumed={}", resumed.size());
            return resumed;
        } finally {
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    public List<AchievementRecord> listAchievements(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        return achievements.findByUser(userId);
    }

    private AchievementCompletion creditAndMark(AchievementRecord pending) {
        LedgerResult credit = pointLedger.credit(
            pending.getUserId(), pending.getPoints(), pending.getIdempotencyKey());

        AchievementRecord credited;
        try {
            credited = achievements.update(pending.markCredited());
        } catch (VersionConflictException e) {
            // PENDING → CREDITED is the only transition, so a lost race means another caller finished it
            credited = achievements.find(pending.getUserId(), pending.getAchievementId())
                .filter(AchievementRecord::isCredited)
                .orElseThrow(() -> new IllegalStateException(
                    "Achievement " + pending.getAchievementId() + " changed concurrently but is not CREDITED", e));
            log.debug("Achievement {} was marked CREDITED by a concurrent completion", pending.getAchievementId());
        }

        log.info("Achievement {} credited: points={}, balance={}, replayed={}",
            credited.getAchievementId(), credited.getPoints(), credit.getBalance(), credit.isReplayed());
        return new AchievementCompletion(credited, AchievementCompletion.Outcome.COMPLETED, credit.getBalance());
    }
}
