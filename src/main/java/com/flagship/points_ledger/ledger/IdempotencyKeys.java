package com.flagship.points_ledger.ledger;

/**
 * Deterministic idempotency keys for ledger operations. Each key is namespaced
 * by the operation that produces it so achievement and redemption keys never collide.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String forAchievement(String userId, String achievementId) {
        return "achievement:" + userId + ":" + achievementId;
    }

    public static String forRedemption(String userId, String requestId) {
        return "redemption:" + userId + ":" + requestId;
    }
}
