package com.flagship.points_ledger.achievement;

/**
 * Lifecycle of an achievement completion.
 *
 * PENDING → CREDITED is the only transition; records are never deleted.
 */
public enum AchievementStatus {
    /**
     * The completion is recorded; the credit may or may not have landed yet.
     * Safe to re-drive because the credit is idempotent.
     */
    PENDING,

    /**
     * The points were credited. Terminal state.
     */
    CREDITED
}
