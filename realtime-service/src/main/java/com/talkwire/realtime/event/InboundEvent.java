package com.talkwire.realtime.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;

import java.util.Optional;

/**
 * Frame received from a client: {@code {"type": ..., "data": {...}}}.
 */
public record InboundEvent(String type, JsonNode data) {

    public InboundEvent {
        if (data == null || data.isNull()) {
            data = MissingNode.getInstance();
        }
    }

    /**
     * Room id, accepted as either {@code room_id} or {@code conversation_id}.
     */
    public Long requireRoomId() {
        return optionalLong("room_id")
                .or(() -> optionalLong("conversation_id"))
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_FIELD, "room_id is required"));
    }

    public Long requireLong(String field) {
        return optionalLong(field)
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_FIELD, field + " is required"));
    }

    public String requireText(String field) {
        return optionalText(field)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_FIELD, field + " is required"));
    }

    public Optional<Long> optionalLong(String field) {
        JsonNode node = data.path(field);
        if (node.isIntegralNumber()) {
            return Optional.of(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Long.parseLong(node.asText()));
            } catch (NumberFormatException e) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, field + " must be numeric");
            }
        }
        return Optional.empty();
    }

    public Optional<String> optionalText(String field) {
        JsonNode node = data.path(field);
        return node.isValueNode() && !node.isNull() ? Optional.of(node.asText()) : Optional.empty();
    }

    public boolean flag(String field) {
        return data.path(field).asBoolean(false);
    }
}
