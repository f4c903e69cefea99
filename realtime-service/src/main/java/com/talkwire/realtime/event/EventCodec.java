package com.talkwire.realtime.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON framing for the client protocol.
 */
@Component
@RequiredArgsConstructor
public class EventCodec {

    private final ObjectMapper objectMapper;

    public String encode(OutboundEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.PROCESSING_ERROR,
                    "Failed to serialize " + event.type() + " event", e);
        }
    }

    public InboundEvent decode(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_JSON);
        }
        if (root == null || !root.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_JSON);
        }
        JsonNode type = root.path("type");
        return new InboundEvent(type.isTextual() ? type.asText() : null, root.get("data"));
    }
}
