package com.talkwire.realtime.dto.response;

import com.talkwire.realtime.registry.PresenceRecord;

import java.time.Instant;

public record PresenceResponse(
        Long userId,
        boolean online,
        int connectionCount,
        Instant lastSeen
) {
    public static PresenceResponse from(PresenceRecord record) {
        return new PresenceResponse(record.userId(), record.online(), record.connectionCount(), record.lastSeen());
    }
}
