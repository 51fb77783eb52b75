package com.expirebot.expiry.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.expirebot.expiry.auth.PermissionCheck;
import com.expirebot.expiry.auth.RedactionPermissionChecker;
import com.expirebot.expiry.lifecycle.RoomLifecycleService;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.policy.RoomPolicyStore;
import com.expirebot.expiry.support.TestProperties;
import com.expirebot.expiry.tracking.TrackedEventStore;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class ExpireCommandHandlerTest {

    private static final String ROOM = "!room:example.org";
    private static final String MOD = "@mod:example.org";
    private static final String USER = "@user:example.org";

    @Mock
    private RoomPolicyStore policyStore;
    @Mock
    private TrackedEventStore trackedEventStore;
    @Mock
    private RedactionPermissionChecker permissionChecker;
    @Mock
    private RoomLifecycleService lifecycleService;
    @Mock
    private MatrixClient matrixClient;

    private ExpireCommandHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ExpireCommandHandler(policyStore, trackedEventStore, permissionChecker, lifecycleService,
                matrixClient, TestProperties.defaults());
    }

    private void allow(String user) {
        when(permissionChecker.check(ROOM, user)).thenReturn(new PermissionCheck(user, 50, 100));
    }

    private void deny(String user) {
        when(permissionChecker.check(ROOM, user)).thenReturn(new PermissionCheck(user, 50, 0));
    }

    @Test
    void recognisesPrefixOnlyAsWholeWord() {
        assertThat(handler.isCommand("!expire show")).isTrue();
        assertThat(handler.isCommand("  !expire")).isTrue();
        assertThat(handler.isCommand("!expired things")).isFalse();
        assertThat(handler.isCommand("hello !expire")).isFalse();
        assertThat(handler.isCommand(null)).isFalse();
    }

    @Test
    void setStoresPolicyAndConfirms() {
        allow(MOD);

        Optional<String> reply = handler.handle(ROOM, MOD, "!expire set 1d2h30m");

        verify(policyStore).upsert(ROOM, 95_400_000L);
        verify(lifecycleService).warnIfBotCannotRedact(ROOM);
        assertThat(reply).contains("Message expiration for this room set to 1d2h30m");
        verify(matrixClient).sendNotice(ROOM, "Message expiration for this room set to 1d2h30m");
    }

    @Test
    void setIsDeniedBelowRedactionLevel() {
        deny(USER);

        Optional<String> reply = handler.handle(ROOM, USER, "!expire set 24h");

        verify(policyStore, never()).upsert(anyString(), anyLong());
        assertThat(reply).hasValueSatisfying(r -> assertThat(r).contains("power level 50"));
    }

    @Test
    void setRejectsBadDuration() {
        allow(MOD);

        Optional<String> reply = handler.handle(ROOM, MOD, "!expire set 1.5h");

        verify(policyStore, never()).upsert(anyString(), anyLong());
        assertThat(reply).hasValueSatisfying(r -> assertThat(r).startsWith("Error parsing duration"));
    }

    @Test
    void setRejectsZero() {
        allow(MOD);

        Optional<String> reply = handler.handle(ROOM, MOD, "!expire set 0s");

        verify(policyStore, never()).upsert(anyString(), anyLong());
        assertThat(reply).contains("Expiration time must be greater than zero.");
    }

    @Test
    void setWithoutArgumentShowsUsage() {
        allow(MOD);

        assertThat(handler.handle(ROOM, MOD, "!expire set"))
                .hasValueSatisfying(r -> assertThat(r).startsWith("Usage:"));
    }

    @Test
    void setReportsStorageFailure() {
        allow(MOD);
        doThrow(new QueryTimeoutException("db")).when(policyStore).upsert(ROOM, 86_400_000L);

        assertThat(handler.handle(ROOM, MOD, "!expire set 24h"))
                .hasValueSatisfying(r -> assertThat(r).contains("Please try again later"));
    }

    @Test
    void unsetDeletesPolicy() {
        allow(MOD);
        when(policyStore.delete(ROOM)).thenReturn(true);

        Optional<String> reply = handler.handle(ROOM, MOD, "!expire unset");

        verify(policyStore).delete(ROOM);
        assertThat(reply).hasValueSatisfying(r -> assertThat(r).contains("has been disabled"));
    }

    @Test
    void unsetIsDeniedBelowRedactionLevel() {
        deny(USER);

        handler.handle(ROOM, USER, "!expire unset");

        verify(policyStore, never()).delete(anyString());
    }

    @Test
    void showReportsTtlAndPendingCount() {
        when(policyStore.get(ROOM)).thenReturn(Optional.of(86_400_000L));
        when(trackedEventStore.countByRoom(ROOM)).thenReturn(3L);

        assertThat(handler.handle(ROOM, USER, "!expire show"))
                .contains("Messages in this room expire after 1d (3 messages pending)");
    }

    @Test
    void showWithoutPolicy() {
        when(policyStore.get(ROOM)).thenReturn(Optional.empty());

        assertThat(handler.handle(ROOM, USER, "!expire show"))
                .contains("No message expiration is set for this room");
    }

    @Test
    void unknownSubcommandPrintsHelp() {
        assertThat(handler.handle(ROOM, USER, "!expire frobnicate"))
                .hasValueSatisfying(r -> assertThat(r).startsWith("Available subcommands"));
    }

    @Test
    void nonCommandIsIgnored() {
        assertThat(handler.handle(ROOM, USER, "just chatting")).isEmpty();
    }
}
