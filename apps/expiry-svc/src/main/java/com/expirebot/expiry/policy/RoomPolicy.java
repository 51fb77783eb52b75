package com.expirebot.expiry.policy;

public record RoomPolicy(String roomId, long ttlMs) {
}
