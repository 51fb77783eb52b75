package com.expirebot.expiry.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.expirebot.expiry.tracking.TrackedEventStore;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.InvalidDataAccessApiUsageException;

@SpringBootTest
class PostgreSQLRoomPolicyStoreTest {

    @Autowired
    RoomPolicyStore policyStore;

    @Autowired
    TrackedEventStore trackedEventStore;

    private static String newRoom() {
        return "!" + UUID.randomUUID() + ":example.org";
    }

    @Test
    void upsertThenGet() {
        String room = newRoom();
        policyStore.upsert(room, 3_600_000L);

        assertThat(policyStore.get(room)).contains(3_600_000L);
    }

    @Test
    void lastWriteWins() {
        String room = newRoom();
        policyStore.upsert(room, 3_600_000L);
        policyStore.upsert(room, 60_000L);

        assertThat(policyStore.get(room)).contains(60_000L);
    }

    @Test
    void getUnknownRoomIsEmpty() {
        assertThat(policyStore.get(newRoom())).isEmpty();
    }

    @Test
    void createIfAbsentKeepsExistingPolicy() {
        String room = newRoom();
        assertThat(policyStore.createIfAbsent(room, 604_800_000L)).isTrue();
        policyStore.upsert(room, 60_000L);

        assertThat(policyStore.createIfAbsent(room, 604_800_000L)).isFalse();
        assertThat(policyStore.get(room)).contains(60_000L);
    }

    @Test
    void deleteRemovesPolicyAndCascadesToTrackedEntries() {
        String room = newRoom();
        String other = newRoom();
        policyStore.upsert(room, 60_000L);
        policyStore.upsert(other, 60_000L);
        trackedEventStore.insert("$a-" + room, room);
        trackedEventStore.insert("$b-" + room, room);
        trackedEventStore.insert("$c-" + other, other);

        assertThat(policyStore.delete(room)).isTrue();

        assertThat(policyStore.get(room)).isEmpty();
        assertThat(trackedEventStore.countByRoom(room)).isZero();
        assertThat(trackedEventStore.countByRoom(other)).isEqualTo(1);
    }

    @Test
    void deleteUnknownRoomIsNoOp() {
        assertThat(policyStore.delete(newRoom())).isFalse();
    }

    @Test
    void listContainsStoredPolicies() {
        String room = newRoom();
        policyStore.upsert(room, 120_000L);

        assertThat(policyStore.list()).contains(new RoomPolicy(room, 120_000L));
    }

    @Test
    void rejectsNonPositiveTtl() {
        String room = newRoom();

        assertThatThrownBy(() -> policyStore.upsert(room, 0))
                .isInstanceOf(InvalidDataAccessApiUsageException.class)
                .hasMessageContaining("ttlMs must be positive");
        assertThatThrownBy(() -> policyStore.createIfAbsent(room, -1))
                .isInstanceOf(InvalidDataAccessApiUsageException.class);
        assertThat(policyStore.get(room)).isEmpty();
    }
}
