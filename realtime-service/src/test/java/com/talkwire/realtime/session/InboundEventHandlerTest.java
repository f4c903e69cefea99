package com.talkwire.realtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.talkwire.realtime.RealtimeHarness;
import com.talkwire.realtime.TestFixtures.MutableClock;
import com.talkwire.realtime.TestFixtures.RecordingConnection;
import com.talkwire.realtime.store.InMemoryMessageStore;
import com.talkwire.realtime.store.MessageStore;
import com.talkwire.realtime.transport.CloseReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InboundEventHandlerTest {

    private RealtimeHarness harness;
    private InMemoryMessageStore store;
    private RecordingConnection alice;
    private RecordingConnection bob;
    private String aliceId;
    private String bobId;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore(new MutableClock());
        store.addParticipant(10L, 1L);
        store.addParticipant(10L, 2L);
        harness = new RealtimeHarness(store);
        alice = new RecordingConnection();
        bob = new RecordingConnection();
        aliceId = harness.connect(1L, alice);
        bobId = harness.connect(2L, bob);
        alice.clear();
        bob.clear();
    }

    @Test
    void ping_repliesPongAndRefreshesHeartbeat() {
        harness.clock.advance(Duration.ofSeconds(40));

        harness.send(aliceId, "{\"type\":\"PING\"}");

        assertThat(alice.framesOfType("PONG")).hasSize(1);
        Instant heartbeat = harness.registry.find(aliceId).orElseThrow().lastHeartbeat();
        assertThat(heartbeat).isEqualTo(harness.clock.instant());
    }

    @Test
    void otherEvents_refreshActivityButNotHeartbeat() {
        Instant connectedAt = harness.clock.instant();
        harness.clock.advance(Duration.ofSeconds(40));

        harness.send(aliceId, "{\"type\":\"JOIN_ROOM\",\"data\":{\"room_id\":30}}");

        assertThat(harness.registry.find(aliceId).orElseThrow().lastHeartbeat()).isEqualTo(connectedAt);
        assertThat(harness.registry.find(aliceId).orElseThrow().lastActivity()).isEqualTo(harness.clock.instant());
    }

    @Test
    void joinRoom_acceptsConversationIdAlias() {
        harness.send(aliceId, "{\"type\":\"JOIN_ROOM\",\"data\":{\"conversation_id\":\"42\"}}");

        JsonNode ack = alice.framesOfType("ROOM_JOINED").get(0);
        assertThat(ack.path("data").path("room_id").asLong()).isEqualTo(42L);
        assertThat(harness.rooms.isMember(42L, 1L)).isTrue();
    }

    @Test
    void leaveRoom_whileTyping_broadcastsStopThenLeaves() {
        harness.send(aliceId, "{\"type\":\"TYPING\",\"data\":{\"room_id\":10,\"is_typing\":true}}");
        bob.clear();

        harness.send(aliceId, "{\"type\":\"LEAVE_ROOM\",\"data\":{\"room_id\":10}}");

        List<JsonNode> typing = bob.framesOfType("TYPING");
        assertThat(typing).hasSize(1);
        assertThat(typing.get(0).path("data").path("is_typing").asBoolean()).isFalse();
        assertThat(alice.framesOfType("ROOM_LEFT")).hasSize(1);
        assertThat(harness.rooms.isMember(10L, 1L)).isFalse();
        assertThat(harness.registry.find(aliceId).orElseThrow().joinedRooms()).doesNotContain(10L);
    }

    @Test
    void leaveRoom_afterTypingExpiredButBeforeSweep_stopSentExactlyOnce() {
        harness.send(aliceId, "{\"type\":\"TYPING\",\"data\":{\"room_id\":10,\"is_typing\":true}}");
        bob.clear();
        harness.clock.advance(Duration.ofSeconds(6));

        harness.send(aliceId, "{\"type\":\"LEAVE_ROOM\",\"data\":{\"room_id\":10}}");
        harness.sweeper.sweep();

        List<JsonNode> typing = bob.framesOfType("TYPING");
        assertThat(typing).hasSize(1);
        assertThat(typing.get(0).path("data").path("user_id").asLong()).isEqualTo(1L);
        assertThat(typing.get(0).path("data").path("is_typing").asBoolean()).isFalse();
    }

    @Test
    void typing_broadcastToOthersOnly() {
        harness.send(aliceId, "{\"type\":\"TYPING\",\"data\":{\"room_id\":10,\"is_typing\":true}}");

        assertThat(bob.framesOfType("TYPING")).hasSize(1);
        assertThat(alice.framesOfType("TYPING")).isEmpty();
        assertThat(harness.typing.isTyping(10L, 1L)).isTrue();
    }

    @Test
    void typing_expiresAfterTtl() {
        harness.send(aliceId, "{\"type\":\"TYPING\",\"data\":{\"room_id\":10,\"is_typing\":true}}");

        harness.clock.advance(Duration.ofMillis(harness.properties.getTypingTtlMs()));

        assertThat(harness.typing.isTyping(10L, 1L)).isFalse();
    }

    @Test
    void message_persistsBroadcastsToWholeRoomAndAcksSender() {
        harness.send(aliceId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10,\"content\":\"hi\",\"temp_id\":\"t-1\"}}");

        JsonNode toBob = bob.framesOfType("NEW_MESSAGE").get(0);
        assertThat(toBob.path("data").path("content").asText()).isEqualTo("hi");
        assertThat(toBob.path("data").path("sender_id").asLong()).isEqualTo(1L);
        assertThat(alice.framesOfType("NEW_MESSAGE")).hasSize(1);

        JsonNode ack = alice.framesOfType("MESSAGE_SENT").get(0);
        assertThat(ack.path("data").path("temp_id").asText()).isEqualTo("t-1");
        assertThat(ack.path("data").path("message_id").asLong())
                .isEqualTo(toBob.path("data").path("id").asLong());
        assertThat(store.findMessagesAfter(10L, null, 50)).hasSize(1);
    }

    @Test
    void message_clearsSendersTypingSignal() {
        harness.send(aliceId, "{\"type\":\"TYPING\",\"data\":{\"room_id\":10,\"is_typing\":true}}");

        harness.send(aliceId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10,\"content\":\"done\"}}");

        assertThat(harness.typing.isTyping(10L, 1L)).isFalse();
        assertThat(harness.typing.sweep(harness.clock.instant().plusSeconds(60))).isEmpty();
    }

    @Test
    void message_missingContent_errorToSenderOnly() {
        harness.send(aliceId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10}}");

        JsonNode error = alice.lastFrame();
        assertThat(error.path("type").asText()).isEqualTo("ERROR");
        assertThat(error.path("data").path("code").asText()).isEqualTo("MISSING_FIELD");
        assertThat(error.path("data").path("retryable").asBoolean()).isFalse();
        assertThat(bob.sent()).isEmpty();
    }

    @Test
    void message_storeDown_retryableError() {
        MessageStore failing = mock(MessageStore.class);
        when(failing.conversationsOf(anyLong())).thenReturn(Set.of());
        when(failing.saveMessage(any(), any(), any())).thenThrow(new IllegalStateException("connection refused"));
        RealtimeHarness degraded = new RealtimeHarness(failing);
        RecordingConnection sender = new RecordingConnection();
        String senderId = degraded.connect(1L, sender);

        degraded.send(senderId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10,\"content\":\"hi\"}}");

        JsonNode error = sender.lastFrame();
        assertThat(error.path("data").path("code").asText()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(error.path("data").path("retryable").asBoolean()).isTrue();
        assertThat(degraded.registry.find(senderId)).isPresent();
    }

    @Test
    void readReceipt_broadcastOnceExcludingReader() {
        harness.send(aliceId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10,\"content\":\"hi\"}}");
        long messageId = alice.framesOfType("MESSAGE_SENT").get(0).path("data").path("message_id").asLong();
        alice.clear();

        String receipt = "{\"type\":\"READ_RECEIPT\",\"data\":{\"conversation_id\":10,\"message_id\":" + messageId + "}}";
        harness.send(bobId, receipt);
        harness.send(bobId, receipt);

        List<JsonNode> receipts = alice.framesOfType("READ_RECEIPT");
        assertThat(receipts).hasSize(1);
        assertThat(receipts.get(0).path("data").path("user_id").asLong()).isEqualTo(2L);
        assertThat(bob.framesOfType("READ_RECEIPT")).isEmpty();
    }

    @Test
    void requestSync_returnsMessagesAfterCursorToRequesterOnly() {
        for (int i = 0; i < 3; i++) {
            harness.send(aliceId, "{\"type\":\"MESSAGE\",\"data\":{\"room_id\":10,\"content\":\"m" + i + "\"}}");
        }
        long firstId = alice.framesOfType("MESSAGE_SENT").get(0).path("data").path("message_id").asLong();
        alice.clear();
        bob.clear();

        harness.send(bobId, "{\"type\":\"REQUEST_SYNC\",\"data\":{\"room_id\":10,\"last_message_id\":" + firstId + "}}");

        JsonNode sync = bob.framesOfType("SYNC_RESPONSE").get(0);
        assertThat(sync.path("data").path("messages")).hasSize(2);
        assertThat(sync.path("data").path("messages").get(0).path("content").asText()).isEqualTo("m1");
        assertThat(alice.sent()).isEmpty();
    }

    @Test
    void requestSync_cappedAtSyncLimit() {
        harness.properties.setSyncLimit(2);
        for (int i = 0; i < 5; i++) {
            store.saveMessage(10L, 1L, "m" + i);
        }

        harness.send(bobId, "{\"type\":\"REQUEST_SYNC\",\"data\":{\"room_id\":10}}");

        assertThat(bob.framesOfType("SYNC_RESPONSE").get(0).path("data").path("messages")).hasSize(2);
    }

    @Test
    void unknownEventType_repliesUnknownEvent() {
        harness.send(aliceId, "{\"type\":\"DANCE\",\"data\":{}}");

        JsonNode reply = alice.lastFrame();
        assertThat(reply.path("type").asText()).isEqualTo("UNKNOWN_EVENT");
        assertThat(reply.path("data").path("message").asText()).contains("DANCE");
    }

    @Test
    void malformedJson_errorAndConnectionStaysOpen() {
        harness.send(aliceId, "{not json");

        assertThat(alice.lastFrame().path("data").path("code").asText()).isEqualTo("INVALID_JSON");
        assertThat(harness.registry.find(aliceId)).isPresent();

        harness.send(aliceId, "{\"type\":\"PING\"}");
        assertThat(alice.framesOfType("PONG")).hasSize(1);
    }

    @Test
    void frameForClosedConnection_ignored() {
        harness.lifecycle.disconnect(aliceId, CloseReason.CLIENT_CLOSED);

        harness.send(aliceId, "{\"type\":\"PING\"}");

        assertThat(alice.sent()).isEmpty();
    }
}
