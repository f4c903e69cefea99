package com.talkwire.realtime.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoredMessage(
        Long id,
        Long conversationId,
        Long senderId,
        String content,
        String type,
        Instant createdAt,
        @JsonProperty("is_read") boolean isRead
) {
    public static final String TYPE_TEXT = "TEXT";
}
