package com.expirebot.expiry.lifecycle;

import com.expirebot.expiry.auth.PermissionCheck;
import com.expirebot.expiry.auth.RedactionPermissionChecker;
import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.duration.DurationParser;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.policy.RoomPolicyStore;
import com.expirebot.expiry.tracking.TrackedEventStore;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Reacts to the bot's own membership changes and to new messages.
 */
@Service
public class RoomLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(RoomLifecycleService.class);

    static final Set<String> TRACKED_MSGTYPES = Set.of(
            "m.text", "m.notice", "m.emote", "m.file", "m.image", "m.video", "m.audio", "m.location");

    private final RoomPolicyStore policyStore;
    private final TrackedEventStore trackedEventStore;
    private final MatrixClient matrixClient;
    private final RedactionPermissionChecker permissionChecker;
    private final long defaultTtlMs;
    private final String commandPrefix;

    public RoomLifecycleService(RoomPolicyStore policyStore,
                                TrackedEventStore trackedEventStore,
                                MatrixClient matrixClient,
                                RedactionPermissionChecker permissionChecker,
                                ExpirebotProperties properties) {
        this.policyStore = policyStore;
        this.trackedEventStore = trackedEventStore;
        this.matrixClient = matrixClient;
        this.permissionChecker = permissionChecker;
        this.defaultTtlMs = properties.policy().defaultTtl().toMillis();
        this.commandPrefix = properties.command().prefix();
    }

    public void onInvited(String roomId, String inviter) {
        log.info("Invited to {} by {}, joining", roomId, inviter);
        try {
            matrixClient.joinRoom(roomId);
        } catch (RuntimeException ex) {
            log.error("Failed to join {} after invite", roomId, ex);
        }
    }

    /**
     * Gives a newly joined room the default policy unless it already has one.
     *
     * @return true if the default policy was assigned
     */
    public boolean onBotJoined(String roomId) {
        boolean created;
        try {
            created = policyStore.createIfAbsent(roomId, defaultTtlMs);
        } catch (DataAccessException ex) {
            log.error("Database error assigning default policy to {}", roomId, ex);
            return false;
        }
        if (!created) {
            log.debug("Joined {} which already has an expiry policy", roomId);
            return false;
        }
        log.info("Joined {}, default expiry of {} assigned", roomId, DurationParser.format(defaultTtlMs));
        notice(roomId, "Hello! Messages in this room will be redacted after " + DurationParser.format(defaultTtlMs)
                + ". Use " + commandPrefix + " set <time> to change this or " + commandPrefix + " unset to disable it.");
        warnIfBotCannotRedact(roomId);
        return true;
    }

    public void onBotLeft(String roomId) {
        try {
            if (policyStore.delete(roomId)) {
                log.info("Left {}, expiry policy and tracked messages removed", roomId);
            }
        } catch (DataAccessException ex) {
            log.error("Database error removing policy of {} after leaving", roomId, ex);
        }
    }

    /**
     * Starts tracking a message when its type expires and its room has a policy.
     *
     * @return true if the message is now tracked
     */
    public boolean onMessage(String roomId, String eventId, String type, String msgtype) {
        if (!isTrackable(type, msgtype)) {
            return false;
        }
        try {
            return trackedEventStore.insert(eventId, roomId);
        } catch (DataAccessException ex) {
            // no one to answer for background events
            log.error("Database error tracking {} in {}", eventId, roomId, ex);
            return false;
        }
    }

    /**
     * Posts a warning when the bot's power level is too low to redact in the room.
     */
    public void warnIfBotCannotRedact(String roomId) {
        PermissionCheck bot = permissionChecker.checkBot(roomId);
        if (!bot.allowed()) {
            log.warn("Bot lacks redaction rights in {} (has {}, needs {})", roomId, bot.actualLevel(), bot.requiredLevel());
            notice(roomId, "Warning: I need power level " + bot.requiredLevel()
                    + " to redact messages in this room, so expired messages will not be removed until I get it.");
        }
    }

    static boolean isTrackable(String type, String msgtype) {
        if ("m.sticker".equals(type)) {
            return true;
        }
        return "m.room.message".equals(type) && msgtype != null && TRACKED_MSGTYPES.contains(msgtype);
    }

    private void notice(String roomId, String text) {
        try {
            matrixClient.sendNotice(roomId, text);
        } catch (RuntimeException ex) {
            log.warn("Could not post notice to {}: {}", roomId, ex.getMessage());
        }
    }
}
