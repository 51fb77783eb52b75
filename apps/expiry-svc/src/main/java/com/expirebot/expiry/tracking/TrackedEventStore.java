package com.expirebot.expiry.tracking;

import java.util.List;

/**
 * Durable index of messages awaiting expiry. Entries only exist while their room has a policy;
 * removing the policy removes them through the database cascade.
 */
public interface TrackedEventStore {

    /**
     * Starts tracking a message if its room currently has a policy. Inserting an event that is
     * already tracked is a no-op.
     *
     * @return true if a new entry was written
     */
    boolean insert(String eventId, String roomId);

    boolean delete(String eventId);

    /**
     * Every tracked entry whose room has a policy, with that policy's TTL. The age check is left
     * to the caller because the message timestamp lives on the homeserver.
     */
    List<TrackedEvent> listExpiryCandidates();

    long countByRoom(String roomId);
}
