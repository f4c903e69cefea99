package com.talkwire.realtime.registry;

import com.talkwire.realtime.transport.ClientConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks live connections per identity on this instance.
 * Supports multiple connections per user (multi-device) and derives
 * presence from the connection count.
 * <p>
 * Mutations for one identity are serialised through {@code compute} on
 * its entry in {@link #userConnections}; different identities never contend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Clock clock;

    // connectionId -> connection
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    // userId -> set of connectionIds
    private final Map<Long, Set<String>> userConnections = new ConcurrentHashMap<>();

    // userId -> derived presence, kept after the user goes offline for last-seen
    private final Map<Long, PresenceRecord> presence = new ConcurrentHashMap<>();

    public Registration register(Long userId, ClientConnection transport, Map<String, String> deviceInfo) {
        String connectionId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Connection connection = new Connection(connectionId, userId, transport, deviceInfo, now);

        AtomicBoolean firstConnection = new AtomicBoolean(false);
        userConnections.compute(userId, (uid, ids) -> {
            Set<String> next = ids != null ? ids : ConcurrentHashMap.newKeySet();
            firstConnection.set(next.isEmpty());
            connections.put(connectionId, connection);
            next.add(connectionId);
            presence.put(uid, new PresenceRecord(uid, next.size(), now));
            return next;
        });

        log.debug("Registered connection: userId={}, connectionId={}, first={}",
                userId, connectionId, firstConnection.get());
        return new Registration(connectionId, userId, firstConnection.get());
    }

    /**
     * Removes a connection. Only the caller that actually removed it gets a
     * result; every other concurrent or repeated call sees an empty optional.
     */
    public Optional<Disconnection> unregister(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        Connection removed = connections.remove(connectionId);
        if (removed == null) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        AtomicBoolean lastConnection = new AtomicBoolean(false);
        userConnections.compute(removed.getUserId(), (uid, ids) -> {
            if (ids != null) {
                ids.remove(connectionId);
            }
            int remaining = ids != null ? ids.size() : 0;
            presence.put(uid, new PresenceRecord(uid, remaining, now));
            if (remaining == 0) {
                lastConnection.set(true);
                return null;
            }
            return ids;
        });
        removed.forceState(SessionState.CLOSED);

        log.debug("Unregistered connection: userId={}, connectionId={}, last={}",
                removed.getUserId(), connectionId, lastConnection.get());
        return Optional.of(new Disconnection(removed.snapshot(), lastConnection.get()));
    }

    public void touchHeartbeat(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touchHeartbeat(clock.instant());
        }
    }

    public void touchActivity(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touchActivity(clock.instant());
        }
    }

    /**
     * Moves a connection from {@code expected} to {@code next}. Returns false
     * when the connection is unknown or in another state.
     */
    public boolean transition(String connectionId, SessionState expected, SessionState next) {
        Connection connection = connections.get(connectionId);
        return connection != null && connection.transition(expected, next);
    }

    /**
     * Runs {@code action} serialised with register, unregister and every other
     * exclusive action for the same user. Used to keep room membership and the
     * per-connection record of it in step across a user's devices.
     * The action must not call {@link #register} or {@link #unregister}.
     */
    public void runExclusive(Long userId, Runnable action) {
        userConnections.compute(userId, (uid, ids) -> {
            action.run();
            return ids;
        });
    }

    /**
     * Records the room as joined through this connection. Returns false when
     * the connection is no longer registered.
     */
    public boolean markRoomJoined(String connectionId, Long roomId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.getJoinedRooms().add(roomId);
        connection.getActiveRooms().add(roomId);
        return true;
    }

    public void markRoomLeft(String connectionId, Long roomId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.getJoinedRooms().remove(roomId);
            connection.getActiveRooms().remove(roomId);
        }
    }

    public void markRoomActive(String connectionId, Long roomId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.getActiveRooms().add(roomId);
        }
    }

    public Set<String> connectionsOf(Long userId) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptySet();
        }
        return Set.copyOf(ids);
    }

    /**
     * Snapshot of the send handles for every live connection of the user.
     */
    public List<ConnectionHandle> handlesOf(Long userId) {
        Set<String> ids = connectionsOf(userId);
        List<ConnectionHandle> handles = new ArrayList<>(ids.size());
        for (String id : ids) {
            Connection connection = connections.get(id);
            if (connection != null) {
                handles.add(connection.handle());
            }
        }
        return handles;
    }

    public Optional<ConnectionHandle> handle(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(Connection::handle);
    }

    public Optional<ConnectionSnapshot> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(Connection::snapshot);
    }

    /**
     * Connections of the user other than {@code connectionId}.
     */
    public List<ConnectionSnapshot> siblingsOf(Long userId, String connectionId) {
        List<ConnectionSnapshot> siblings = new ArrayList<>();
        for (String id : connectionsOf(userId)) {
            if (id.equals(connectionId)) {
                continue;
            }
            Connection connection = connections.get(id);
            if (connection != null) {
                siblings.add(connection.snapshot());
            }
        }
        return siblings;
    }

    /**
     * Ids of connections whose last heartbeat is strictly before {@code cutoff}.
     */
    public List<String> staleConnections(Instant cutoff) {
        List<String> stale = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.getLastHeartbeat().isBefore(cutoff)) {
                stale.add(connection.getId());
            }
        }
        return stale;
    }

    public Set<String> allConnectionIds() {
        return Set.copyOf(connections.keySet());
    }

    public Set<Long> onlineUserIds() {
        return Set.copyOf(userConnections.keySet());
    }

    public boolean isOnline(Long userId) {
        Set<String> ids = userConnections.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public PresenceRecord presenceOf(Long userId) {
        return presence.getOrDefault(userId, PresenceRecord.unknown(userId));
    }

    public int getOnlineUserCount() {
        return userConnections.size();
    }

    public int getTotalConnections() {
        return connections.size();
    }
}
