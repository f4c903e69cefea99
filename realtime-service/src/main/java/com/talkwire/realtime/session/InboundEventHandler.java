package com.talkwire.realtime.session;

import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;
import com.talkwire.realtime.config.RealtimeProperties;
import com.talkwire.realtime.dispatch.MessageDispatcher;
import com.talkwire.realtime.event.EventCodec;
import com.talkwire.realtime.event.InboundEvent;
import com.talkwire.realtime.event.InboundEventType;
import com.talkwire.realtime.event.OutboundEvent;
import com.talkwire.realtime.registry.ConnectionRegistry;
import com.talkwire.realtime.registry.ConnectionSnapshot;
import com.talkwire.realtime.room.RoomMembershipIndex;
import com.talkwire.realtime.store.MessageStore;
import com.talkwire.realtime.store.StoreUnavailableException;
import com.talkwire.realtime.store.StoredMessage;
import com.talkwire.realtime.store.StoredReadReceipt;
import com.talkwire.realtime.typing.TypingSignalTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Routes inbound frames of one connection. A failure is answered with an
 * {@code ERROR} frame to that connection only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundEventHandler {

    private final ConnectionRegistry registry;
    private final RoomMembershipIndex rooms;
    private final TypingSignalTracker typing;
    private final MessageDispatcher dispatcher;
    private final MessageStore messageStore;
    private final EventCodec codec;
    private final RealtimeProperties properties;
    private final Clock clock;

    public void handle(String connectionId, String rawFrame) {
        Optional<ConnectionSnapshot> connection = registry.find(connectionId);
        if (connection.isEmpty()) {
            log.debug("Frame for closed connection ignored: connectionId={}", connectionId);
            return;
        }
        registry.touchActivity(connectionId);
        Long userId = connection.get().userId();

        try {
            InboundEvent event = codec.decode(rawFrame);
            Optional<InboundEventType> type = InboundEventType.from(event.type());
            if (type.isEmpty()) {
                log.warn("Unknown event type '{}' from userId={}", event.type(), userId);
                dispatcher.sendToConnection(connectionId, OutboundEvent.unknownEvent(event.type()));
                return;
            }

            log.debug("Inbound {} from userId={}, connectionId={}", type.get(), userId, connectionId);
            switch (type.get()) {
                case PING -> onPing(connectionId);
                case JOIN_ROOM -> onJoinRoom(connectionId, userId, event);
                case LEAVE_ROOM -> onLeaveRoom(connectionId, userId, event);
                case TYPING -> onTyping(connectionId, userId, event);
                case MESSAGE -> onMessage(connectionId, userId, event);
                case READ_RECEIPT -> onReadReceipt(connectionId, userId, event);
                case REQUEST_SYNC -> onRequestSync(connectionId, event);
            }
        } catch (BusinessException e) {
            log.warn("Rejected event from userId={}: {} {}", userId, e.getErrorCode().getCode(), e.getMessage());
            dispatcher.sendToConnection(connectionId, OutboundEvent.error(e));
        } catch (Exception e) {
            log.error("Event handling error: userId={}, connectionId={}", userId, connectionId, e);
            dispatcher.sendToConnection(connectionId,
                    OutboundEvent.error(ErrorCode.PROCESSING_ERROR, ErrorCode.PROCESSING_ERROR.getMessage()));
        }
    }

    private void onPing(String connectionId) {
        registry.touchHeartbeat(connectionId);
        dispatcher.sendToConnection(connectionId, OutboundEvent.pong(clock.instant()));
    }

    private void onJoinRoom(String connectionId, Long userId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        registry.runExclusive(userId, () -> {
            if (registry.markRoomJoined(connectionId, roomId)) {
                rooms.join(roomId, userId);
            }
        });
        dispatcher.sendToConnection(connectionId, OutboundEvent.roomJoined(roomId));
    }

    private void onLeaveRoom(String connectionId, Long userId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        if (typing.clearTyping(roomId, userId)) {
            dispatcher.broadcastToRoom(roomId, OutboundEvent.typing(roomId, userId, false, clock.instant()), userId);
        }
        registry.runExclusive(userId, () -> {
            rooms.leave(roomId, userId);
            for (String id : registry.connectionsOf(userId)) {
                registry.markRoomLeft(id, roomId);
            }
        });
        dispatcher.sendToConnection(connectionId, OutboundEvent.roomLeft(roomId));
    }

    private void onTyping(String connectionId, Long userId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        boolean isTyping = event.flag("is_typing");
        registry.markRoomActive(connectionId, roomId);

        if (isTyping) {
            typing.setTyping(roomId, userId, Duration.ofMillis(properties.getTypingTtlMs()));
        } else {
            typing.clearTyping(roomId, userId);
        }
        dispatcher.broadcastToRoom(roomId, OutboundEvent.typing(roomId, userId, isTyping, clock.instant()), userId);
    }

    private void onMessage(String connectionId, Long userId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        String content = event.requireText("content");
        String tempId = event.optionalText("temp_id").orElse(null);

        StoredMessage message = callStore(() -> messageStore.saveMessage(roomId, userId, content));

        // a sent message ends the sender's typing without a separate stop event
        typing.clearTyping(roomId, userId);
        registry.markRoomActive(connectionId, roomId);

        dispatcher.broadcastToRoom(roomId, OutboundEvent.newMessage(message), null);
        dispatcher.sendToConnection(connectionId, OutboundEvent.messageSent(tempId, message.id()));
        log.debug("Message {} saved in room {} by userId={}", message.id(), roomId, userId);
    }

    private void onReadReceipt(String connectionId, Long userId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        Long messageId = event.requireLong("message_id");
        registry.markRoomActive(connectionId, roomId);

        Optional<StoredReadReceipt> receipt = callStore(() -> messageStore.saveReadReceipt(roomId, messageId, userId));
        receipt.ifPresent(r -> dispatcher.broadcastToRoom(roomId, OutboundEvent.readReceipt(r), userId));
    }

    private void onRequestSync(String connectionId, InboundEvent event) {
        Long roomId = event.requireRoomId();
        Long lastMessageId = event.optionalLong("last_message_id").orElse(null);

        List<StoredMessage> messages = callStore(
                () -> messageStore.findMessagesAfter(roomId, lastMessageId, properties.getSyncLimit()));
        dispatcher.sendToConnection(connectionId, OutboundEvent.syncResponse(roomId, messages));
    }

    private <T> T callStore(Supplier<T> call) {
        try {
            return call.get();
        } catch (BusinessException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreUnavailableException("Message store call failed", e);
        }
    }
}
