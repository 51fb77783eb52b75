package com.expirebot.expiry.auth;

import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.matrix.PowerLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RedactionPermissionChecker {

    private static final Logger log = LoggerFactory.getLogger(RedactionPermissionChecker.class);

    private final MatrixClient matrixClient;
    private final String botUserId;

    public RedactionPermissionChecker(MatrixClient matrixClient, ExpirebotProperties properties) {
        this.matrixClient = matrixClient;
        this.botUserId = properties.homeserver().botUserId();
    }

    /**
     * Compares the user's power level in the room against the redaction level. When the power
     * levels cannot be read the check fails closed.
     */
    public PermissionCheck check(String roomId, String userId) {
        try {
            PowerLevels levels = matrixClient.getPowerLevels(roomId);
            return new PermissionCheck(userId, levels.redactionLevel(), levels.userLevel(userId));
        } catch (RuntimeException ex) {
            log.error("Error checking redaction permissions of {} in {}", userId, roomId, ex);
            return new PermissionCheck(userId, PowerLevels.DEFAULT_REDACTION_LEVEL, Integer.MIN_VALUE);
        }
    }

    public PermissionCheck checkBot(String roomId) {
        return check(roomId, botUserId);
    }
}
