package com.talkwire.realtime.registry;

import com.talkwire.realtime.transport.ClientConnection;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable connection state. Only {@link ConnectionRegistry} holds instances;
 * everything else sees {@link ConnectionSnapshot} or {@link ConnectionHandle}.
 */
@Getter
class Connection {

    private final String id;
    private final Long userId;
    private final ClientConnection transport;
    private final Map<String, String> deviceInfo;
    private final Instant connectedAt;
    private volatile Instant lastActivity;
    private volatile Instant lastHeartbeat;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.AUTHENTICATED);

    // rooms joined through this connection
    private final Set<Long> joinedRooms = ConcurrentHashMap.newKeySet();
    // rooms this connection typed, posted or joined in
    private final Set<Long> activeRooms = ConcurrentHashMap.newKeySet();

    Connection(String id, Long userId, ClientConnection transport, Map<String, String> deviceInfo, Instant now) {
        this.id = id;
        this.userId = userId;
        this.transport = transport;
        this.deviceInfo = deviceInfo == null ? Map.of() : Map.copyOf(deviceInfo);
        this.connectedAt = now;
        this.lastActivity = now;
        this.lastHeartbeat = now;
    }

    void touchActivity(Instant now) {
        this.lastActivity = now;
    }

    void touchHeartbeat(Instant now) {
        this.lastHeartbeat = now;
        this.lastActivity = now;
    }

    boolean transition(SessionState expected, SessionState next) {
        return state.compareAndSet(expected, next);
    }

    void forceState(SessionState next) {
        state.set(next);
    }

    ConnectionHandle handle() {
        return new ConnectionHandle(id, userId, transport);
    }

    ConnectionSnapshot snapshot() {
        return new ConnectionSnapshot(id, userId, deviceInfo, connectedAt, lastActivity, lastHeartbeat,
                state.get(), Set.copyOf(joinedRooms), Set.copyOf(activeRooms));
    }
}
