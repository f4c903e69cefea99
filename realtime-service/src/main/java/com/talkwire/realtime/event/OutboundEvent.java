package com.talkwire.realtime.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;
import com.talkwire.realtime.store.StoredMessage;
import com.talkwire.realtime.store.StoredReadReceipt;

import java.time.Instant;
import java.util.List;

/**
 * Frame sent to clients: {@code {"type": ..., "data": {...}}}.
 */
public record OutboundEvent(OutboundEventType type, Object data) {

    public static OutboundEvent connectionAccepted(String connectionId, Long userId, Instant connectedAt) {
        return new OutboundEvent(OutboundEventType.CONNECTION_SUCCESS,
                new ConnectionAccepted(connectionId, userId, connectedAt, "WebSocket connected successfully"));
    }

    public static OutboundEvent pong(Instant now) {
        return new OutboundEvent(OutboundEventType.PONG, new Pong(now));
    }

    public static OutboundEvent roomJoined(Long roomId) {
        return new OutboundEvent(OutboundEventType.ROOM_JOINED, new RoomAck(roomId, "success"));
    }

    public static OutboundEvent roomLeft(Long roomId) {
        return new OutboundEvent(OutboundEventType.ROOM_LEFT, new RoomAck(roomId, "success"));
    }

    public static OutboundEvent typing(Long roomId, Long userId, boolean isTyping, Instant now) {
        return new OutboundEvent(OutboundEventType.TYPING, new TypingChanged(roomId, userId, isTyping, now));
    }

    public static OutboundEvent newMessage(StoredMessage message) {
        return new OutboundEvent(OutboundEventType.NEW_MESSAGE, message);
    }

    public static OutboundEvent messageSent(String tempId, Long messageId) {
        return new OutboundEvent(OutboundEventType.MESSAGE_SENT, new MessageSent(tempId, messageId, "delivered"));
    }

    public static OutboundEvent readReceipt(StoredReadReceipt receipt) {
        return new OutboundEvent(OutboundEventType.READ_RECEIPT, receipt);
    }

    public static OutboundEvent presence(Long userId, boolean online, Instant lastSeen) {
        return new OutboundEvent(OutboundEventType.PRESENCE_UPDATE, new PresenceChanged(userId, online, lastSeen));
    }

    public static OutboundEvent syncResponse(Long conversationId, List<StoredMessage> messages) {
        return new OutboundEvent(OutboundEventType.SYNC_RESPONSE, new SyncResponse(conversationId, messages));
    }

    public static OutboundEvent error(ErrorCode errorCode, String message) {
        return new OutboundEvent(OutboundEventType.ERROR,
                new ErrorPayload(errorCode.getCode(), message, errorCode.isRetryable()));
    }

    public static OutboundEvent error(BusinessException e) {
        return error(e.getErrorCode(), e.getMessage());
    }

    public static OutboundEvent unknownEvent(String receivedType) {
        return new OutboundEvent(OutboundEventType.UNKNOWN_EVENT,
                new ErrorPayload(ErrorCode.UNKNOWN_EVENT.getCode(), "Unknown event type: " + receivedType, false));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ConnectionAccepted(String connectionId, Long userId, Instant connectedAt, String message) {
    }

    public record Pong(Instant timestamp) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RoomAck(Long roomId, String status) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TypingChanged(Long roomId, Long userId, @JsonProperty("is_typing") boolean isTyping,
                                Instant timestamp) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MessageSent(String tempId, Long messageId, String status) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PresenceChanged(Long userId, @JsonProperty("is_online") boolean isOnline, Instant lastSeen) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SyncResponse(Long conversationId, List<StoredMessage> messages) {
    }

    public record ErrorPayload(String code, String message, boolean retryable) {
    }
}
