package com.expirebot.expiry.appservice;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A room event as pushed by the homeserver in an application service transaction.
 */
public record RoomEvent(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("type") String type,
        @JsonProperty("room_id") String roomId,
        @JsonProperty("sender") String sender,
        @JsonProperty("state_key") String stateKey,
        @JsonProperty("content") Map<String, Object> content
) {

    public String contentString(String key) {
        if (content == null) {
            return null;
        }
        Object value = content.get(key);
        return value instanceof String s ? s : null;
    }
}
