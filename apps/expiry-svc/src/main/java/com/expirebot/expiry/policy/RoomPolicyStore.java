package com.expirebot.expiry.policy;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping of room id to message time-to-live.
 *
 * <p>Storage failures surface as Spring {@link org.springframework.dao.DataAccessException}s; no
 * operation leaves a partially applied write behind.
 */
public interface RoomPolicyStore {

    /**
     * Inserts or replaces the TTL for a room. Last write wins.
     *
     * @throws org.springframework.dao.InvalidDataAccessApiUsageException if {@code ttlMs} is not positive
     */
    void upsert(String roomId, long ttlMs);

    /**
     * Inserts the TTL only when the room has no policy yet.
     *
     * @return true if a policy was created
     */
    boolean createIfAbsent(String roomId, long ttlMs);

    /**
     * Removes the policy together with every tracked entry of the room.
     *
     * @return true if a policy existed
     */
    boolean delete(String roomId);

    Optional<Long> get(String roomId);

    List<RoomPolicy> list();
}
