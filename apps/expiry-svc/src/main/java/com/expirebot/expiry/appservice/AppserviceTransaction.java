package com.expirebot.expiry.appservice;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record AppserviceTransaction(@JsonProperty("events") List<RoomEvent> events) {

    public List<RoomEvent> eventsOrEmpty() {
        return events != null ? events : List.of();
    }
}
