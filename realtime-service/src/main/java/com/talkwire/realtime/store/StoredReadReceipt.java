package com.talkwire.realtime.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoredReadReceipt(Long messageId, Long conversationId, Long userId, Instant readAt) {
}
