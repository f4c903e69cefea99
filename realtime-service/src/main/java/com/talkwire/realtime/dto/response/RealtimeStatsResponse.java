package com.talkwire.realtime.dto.response;

public record RealtimeStatsResponse(
        int onlineUsers,
        int totalConnections,
        int activeRooms,
        int activeTypingSignals
) {
}
