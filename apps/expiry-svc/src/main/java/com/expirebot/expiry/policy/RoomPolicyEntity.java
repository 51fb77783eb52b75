package com.expirebot.expiry.policy;

import jakarta.persistence.*;

@Entity
@Table(name = "room_policy")
public class RoomPolicyEntity {

    @Id
    @Column(name = "room_id", nullable = false, updatable = false)
    private String roomId;

    @Column(name = "ttl_ms", nullable = false)
    private long ttlMs;

    protected RoomPolicyEntity() {}

    public RoomPolicyEntity(String roomId, long ttlMs) {
        this.roomId = roomId;
        this.ttlMs = ttlMs;
    }

    public String getRoomId() { return roomId; }
    public long getTtlMs() { return ttlMs; }

    public RoomPolicy toModel() {
        return new RoomPolicy(roomId, ttlMs);
    }
}
