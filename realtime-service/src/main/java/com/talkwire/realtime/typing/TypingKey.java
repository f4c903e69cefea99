package com.talkwire.realtime.typing;

public record TypingKey(Long roomId, Long userId) {
}
