package com.expirebot.expiry.tracking;

/**
 * A tracked message joined with the TTL of the room it was posted in.
 */
public record TrackedEvent(String eventId, String roomId, long ttlMs) {
}
