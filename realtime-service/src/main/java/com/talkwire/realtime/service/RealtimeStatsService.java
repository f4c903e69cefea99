package com.talkwire.realtime.service;

import com.talkwire.realtime.dto.response.PresenceResponse;
import com.talkwire.realtime.dto.response.RealtimeStatsResponse;
import com.talkwire.realtime.registry.ConnectionRegistry;
import com.talkwire.realtime.room.RoomMembershipIndex;
import com.talkwire.realtime.typing.TypingSignalTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only view over the in-memory state. Counts are taken one component at
 * a time and may be mutually inconsistent under load.
 */
@Service
@RequiredArgsConstructor
public class RealtimeStatsService {

    private final ConnectionRegistry registry;
    private final RoomMembershipIndex rooms;
    private final TypingSignalTracker typing;

    public RealtimeStatsResponse getStats() {
        return new RealtimeStatsResponse(
                registry.getOnlineUserCount(),
                registry.getTotalConnections(),
                rooms.getActiveRoomCount(),
                typing.getActiveSignalCount());
    }

    public List<Long> getOnlineUsers() {
        return registry.onlineUserIds().stream().sorted().toList();
    }

    public PresenceResponse getPresence(Long userId) {
        return PresenceResponse.from(registry.presenceOf(userId));
    }
}
