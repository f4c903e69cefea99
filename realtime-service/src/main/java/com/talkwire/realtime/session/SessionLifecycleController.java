package com.talkwire.realtime.session;

import com.talkwire.common.exception.BusinessException;
import com.talkwire.common.response.ErrorCode;
import com.talkwire.realtime.auth.IdentityVerifier;
import com.talkwire.realtime.config.RealtimeProperties;
import com.talkwire.realtime.dispatch.ConnectionDroppedEvent;
import com.talkwire.realtime.dispatch.MessageDispatcher;
import com.talkwire.realtime.event.OutboundEvent;
import com.talkwire.realtime.registry.ConnectionHandle;
import com.talkwire.realtime.registry.ConnectionRegistry;
import com.talkwire.realtime.registry.ConnectionSnapshot;
import com.talkwire.realtime.registry.Disconnection;
import com.talkwire.realtime.registry.Registration;
import com.talkwire.realtime.registry.SessionState;
import com.talkwire.realtime.room.RoomMembershipIndex;
import com.talkwire.realtime.store.MessageStore;
import com.talkwire.realtime.transport.ClientConnection;
import com.talkwire.realtime.transport.CloseReason;
import com.talkwire.realtime.typing.TypingSignalTracker;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a connection from authentication to teardown.
 * <p>
 * Teardown can be triggered by the client, the liveness sweeper, a failed send
 * or server shutdown. Whichever source unregisters the connection first runs
 * the cleanup; every later call is a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionLifecycleController {

    private final ConnectionRegistry registry;
    private final RoomMembershipIndex rooms;
    private final TypingSignalTracker typing;
    private final MessageDispatcher dispatcher;
    private final IdentityVerifier identityVerifier;
    private final MessageStore messageStore;
    private final RealtimeProperties properties;
    private final Clock clock;

    /**
     * Authenticates and registers a new transport.
     *
     * @return the connection id, or empty when the transport was rejected and closed
     */
    public Optional<String> open(ClientConnection transport, String credential, Map<String, String> deviceInfo) {
        Optional<Long> identity;
        try {
            identity = identityVerifier.verify(credential);
        } catch (Exception e) {
            log.error("Identity verification failed unexpectedly", e);
            transport.close(CloseReason.AUTH_FAILED);
            return Optional.empty();
        }

        if (identity.isEmpty()) {
            log.warn("WebSocket rejected: invalid credential");
            transport.close(CloseReason.AUTH_FAILED);
            return Optional.empty();
        }

        if (registry.getTotalConnections() >= properties.getMaxConnections()) {
            log.warn("WebSocket rejected: connection limit {} reached, userId={}",
                    properties.getMaxConnections(), identity.get());
            transport.close(CloseReason.OVERLOADED);
            return Optional.empty();
        }

        Long userId = identity.get();
        Registration registration = registry.register(userId, transport, deviceInfo);
        String connectionId = registration.connectionId();
        Instant now = clock.instant();

        dispatcher.sendToConnection(connectionId, OutboundEvent.connectionAccepted(connectionId, userId, now));
        if (registry.find(connectionId).isEmpty()) {
            // dropped while sending the greeting; cleanup already ran
            return Optional.empty();
        }

        autoJoin(connectionId, userId);

        if (registration.firstConnection()) {
            broadcastPresence(userId, true, now);
        }
        registry.transition(connectionId, SessionState.AUTHENTICATED, SessionState.ACTIVE);

        log.info("WebSocket connected: userId={}, connectionId={}, devices={}",
                userId, connectionId, registry.connectionsOf(userId).size());
        return Optional.of(connectionId);
    }

    /**
     * Closes and cleans up a connection. Safe to call repeatedly and concurrently.
     */
    public void disconnect(String connectionId, CloseReason reason) {
        Optional<ConnectionHandle> handle = registry.handle(connectionId);
        if (handle.isEmpty()) {
            return;
        }
        registry.transition(connectionId, SessionState.ACTIVE, SessionState.CLOSING);

        Optional<Disconnection> disconnection = registry.unregister(connectionId);
        if (disconnection.isEmpty()) {
            return;
        }
        if (reason != CloseReason.CLIENT_CLOSED) {
            handle.get().transport().close(reason);
        }
        completeClose(disconnection.get(), reason);
    }

    @EventListener
    public void onConnectionDropped(ConnectionDroppedEvent event) {
        completeClose(event.disconnection(), event.reason());
    }

    @PreDestroy
    public void shutdown() {
        Set<String> connectionIds = registry.allConnectionIds();
        if (connectionIds.isEmpty()) {
            return;
        }
        log.info("Closing {} connections for shutdown", connectionIds.size());
        for (String connectionId : connectionIds) {
            try {
                disconnect(connectionId, CloseReason.SERVER_SHUTDOWN);
            } catch (Exception e) {
                log.error("Failed to close connection on shutdown: connectionId={}", connectionId, e);
            }
        }
    }

    private void completeClose(Disconnection disconnection, CloseReason reason) {
        ConnectionSnapshot connection = disconnection.connection();
        Long userId = connection.userId();
        Instant now = clock.instant();

        List<Long> cleared = typing.clearTyping(userId, connection.activeRooms());
        for (Long roomId : cleared) {
            dispatcher.broadcastToRoom(roomId, OutboundEvent.typing(roomId, userId, false, now), userId);
        }

        if (disconnection.lastConnection()) {
            broadcastPresence(userId, false, now);
        }

        // a sibling joining concurrently marks the room under the same exclusive section
        registry.runExclusive(userId, () -> {
            Set<Long> heldBySiblings = new HashSet<>();
            for (ConnectionSnapshot sibling : registry.siblingsOf(userId, connection.connectionId())) {
                heldBySiblings.addAll(sibling.joinedRooms());
            }
            for (Long roomId : connection.joinedRooms()) {
                if (!heldBySiblings.contains(roomId)) {
                    rooms.leave(roomId, userId);
                }
            }
        });

        log.info("WebSocket disconnected: userId={}, connectionId={}, reason={}, offline={}",
                userId, connection.connectionId(), reason, disconnection.lastConnection());
    }

    private void autoJoin(String connectionId, Long userId) {
        Set<Long> conversations;
        try {
            conversations = messageStore.conversationsOf(userId);
        } catch (BusinessException e) {
            log.warn("Auto-join skipped for userId={}: {}", userId, e.getMessage());
            dispatcher.sendToConnection(connectionId, OutboundEvent.error(e));
            return;
        } catch (Exception e) {
            log.error("Auto-join failed for userId={}", userId, e);
            dispatcher.sendToConnection(connectionId,
                    OutboundEvent.error(ErrorCode.STORE_UNAVAILABLE, "Could not load conversations"));
            return;
        }

        for (Long roomId : conversations) {
            registry.runExclusive(userId, () -> {
                if (registry.markRoomJoined(connectionId, roomId)) {
                    rooms.join(roomId, userId);
                }
            });
        }
        if (!conversations.isEmpty()) {
            log.debug("Auto-joined userId={} to {} rooms", userId, conversations.size());
        }
    }

    private void broadcastPresence(Long userId, boolean online, Instant lastSeen) {
        OutboundEvent event = OutboundEvent.presence(userId, online, lastSeen);
        for (Long roomId : rooms.roomsOf(userId)) {
            dispatcher.broadcastToRoom(roomId, event, userId);
        }
    }
}
