package com.talkwire.realtime.registry;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record ConnectionSnapshot(
        String connectionId,
        Long userId,
        Map<String, String> deviceInfo,
        Instant connectedAt,
        Instant lastActivity,
        Instant lastHeartbeat,
        SessionState state,
        Set<Long> joinedRooms,
        Set<Long> activeRooms
) {
}
