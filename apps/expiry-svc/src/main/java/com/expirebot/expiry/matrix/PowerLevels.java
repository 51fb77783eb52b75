package com.expirebot.expiry.matrix;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Content of a room's {@code m.room.power_levels} state event.
 */
public record PowerLevels(
        @JsonProperty("users") Map<String, Integer> users,
        @JsonProperty("users_default") Integer usersDefault,
        @JsonProperty("events") Map<String, Integer> events,
        @JsonProperty("redact") Integer redact
) {

    public static final int DEFAULT_REDACTION_LEVEL = 50;
    static final String REDACTION_EVENT_TYPE = "m.room.redaction";

    public static PowerLevels empty() {
        return new PowerLevels(Map.of(), 0, Map.of(), null);
    }

    public int userLevel(String userId) {
        if (users != null && users.get(userId) != null) {
            return users.get(userId);
        }
        return usersDefault != null ? usersDefault : 0;
    }

    /**
     * Level needed to redact other users' messages: the {@code m.room.redaction} event level if
     * set, else the room's {@code redact} level, else 50.
     */
    public int redactionLevel() {
        if (events != null && events.get(REDACTION_EVENT_TYPE) != null) {
            return events.get(REDACTION_EVENT_TYPE);
        }
        return redact != null ? redact : DEFAULT_REDACTION_LEVEL;
    }
}
