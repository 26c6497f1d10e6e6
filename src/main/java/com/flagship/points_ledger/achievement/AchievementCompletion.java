package com.flagship.points_ledger.achievement;

import lombok.Value;

/**
 * Result of completing an achievement.
 */
@Value
public class AchievementCompletion {

    public enum Outcome {
        /**
         * This call drove the record to CREDITED (including resuming a PENDING one).
         */
        COMPLETED,

        /**
         * The achievement had already been credited; nothing changed.
         */
        ALREADY_COMPLETED
    }

    AchievementRecord record;
    Outcome outcome;
    long balance;
}
