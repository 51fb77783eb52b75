package com.expirebot.expiry.command;

import com.expirebot.expiry.auth.PermissionCheck;
import com.expirebot.expiry.auth.RedactionPermissionChecker;
import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.duration.DurationParser;
import com.expirebot.expiry.duration.InvalidDurationFormatException;
import com.expirebot.expiry.lifecycle.RoomLifecycleService;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.policy.RoomPolicyStore;
import com.expirebot.expiry.tracking.TrackedEventStore;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Handles {@code !expire set <time>}, {@code !expire unset} and {@code !expire show}. Every
 * command answers with a notice in the room it came from.
 */
@Service
public class ExpireCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(ExpireCommandHandler.class);

    private final RoomPolicyStore policyStore;
    private final TrackedEventStore trackedEventStore;
    private final RedactionPermissionChecker permissionChecker;
    private final RoomLifecycleService lifecycleService;
    private final MatrixClient matrixClient;
    private final String prefix;

    public ExpireCommandHandler(RoomPolicyStore policyStore,
                                TrackedEventStore trackedEventStore,
                                RedactionPermissionChecker permissionChecker,
                                RoomLifecycleService lifecycleService,
                                MatrixClient matrixClient,
                                ExpirebotProperties properties) {
        this.policyStore = policyStore;
        this.trackedEventStore = trackedEventStore;
        this.permissionChecker = permissionChecker;
        this.lifecycleService = lifecycleService;
        this.matrixClient = matrixClient;
        this.prefix = properties.command().prefix();
    }

    public boolean isCommand(String body) {
        if (body == null) {
            return false;
        }
        String trimmed = body.strip();
        return trimmed.startsWith(prefix)
                && (trimmed.length() == prefix.length() || Character.isWhitespace(trimmed.charAt(prefix.length())));
    }

    /**
     * Runs the command in {@code body} and returns the reply that was posted, or empty when the
     * body is not addressed to this bot.
     */
    public Optional<String> handle(String roomId, String sender, String body) {
        if (!isCommand(body)) {
            return Optional.empty();
        }
        String[] parts = body.strip().substring(prefix.length()).strip().split("\\s+", 2);
        String subcommand = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].strip() : "";

        String reply = switch (subcommand) {
            case "set" -> set(roomId, sender, argument);
            case "unset" -> unset(roomId, sender);
            case "show" -> show(roomId);
            default -> help();
        };
        try {
            matrixClient.sendNotice(roomId, reply);
        } catch (RuntimeException ex) {
            log.error("Could not deliver reply to {} in {}", sender, roomId, ex);
        }
        return Optional.of(reply);
    }

    private String set(String roomId, String sender, String argument) {
        PermissionCheck check = permissionChecker.check(roomId, sender);
        if (!check.allowed()) {
            return denied(check);
        }
        if (argument.isEmpty()) {
            return "Usage: " + prefix + " set <time>, e.g. " + prefix + " set 24h or " + prefix + " set 1d2h30m";
        }
        long ttlMs;
        try {
            ttlMs = DurationParser.parseMillis(argument);
        } catch (InvalidDurationFormatException ex) {
            return "Error parsing duration: " + ex.getMessage();
        }
        if (ttlMs == 0) {
            return "Expiration time must be greater than zero.";
        }
        try {
            policyStore.upsert(roomId, ttlMs);
        } catch (DataAccessException ex) {
            log.error("Database error in expire set for {}", roomId, ex);
            return "Failed to update room expiration settings. Please try again later.";
        }
        log.info("{} set message expiration in {} to {} ms", sender, roomId, ttlMs);
        lifecycleService.warnIfBotCannotRedact(roomId);
        return "Message expiration for this room set to " + DurationParser.format(ttlMs);
    }

    private String unset(String roomId, String sender) {
        PermissionCheck check = permissionChecker.check(roomId, sender);
        if (!check.allowed()) {
            return denied(check);
        }
        try {
            policyStore.delete(roomId);
        } catch (DataAccessException ex) {
            log.error("Database error in expire unset for {}", roomId, ex);
            return "Failed to disable room expiration. Please try again later.";
        }
        log.info("{} disabled message expiration in {}", sender, roomId);
        return "Message expiration for this room has been disabled. All tracked messages will be preserved.";
    }

    private String show(String roomId) {
        try {
            Optional<Long> ttlMs = policyStore.get(roomId);
            if (ttlMs.isEmpty()) {
                return "No message expiration is set for this room";
            }
            long tracked = trackedEventStore.countByRoom(roomId);
            return "Messages in this room expire after " + DurationParser.format(ttlMs.get())
                    + " (" + tracked + " messages pending)";
        } catch (DataAccessException ex) {
            log.error("Database error in expire show for {}", roomId, ex);
            return "Failed to fetch room expiration settings. Please try again later.";
        }
    }

    private String denied(PermissionCheck check) {
        return "Only users with power level " + check.requiredLevel() + " or higher can change message expiration.";
    }

    private String help() {
        return "Available subcommands:\n"
                + "  " + prefix + " set <time> - Set expiration time (e.g. " + prefix + " set 24h)\n"
                + "  " + prefix + " unset - Disable message expiration\n"
                + "  " + prefix + " show - Show current expiration settings";
    }
}
