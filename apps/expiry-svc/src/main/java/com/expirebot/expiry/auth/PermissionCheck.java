package com.expirebot.expiry.auth;

/**
 * Outcome of comparing a user's power level with the level a room requires for redactions.
 */
public record PermissionCheck(String userId, int requiredLevel, int actualLevel) {

    public boolean allowed() {
        return actualLevel >= requiredLevel;
    }
}
