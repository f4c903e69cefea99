package com.talkwire.realtime.dispatch;

import com.talkwire.common.event.RoomBroadcastEvent;
import com.talkwire.realtime.event.EventCodec;
import com.talkwire.realtime.event.OutboundEvent;
import com.talkwire.realtime.registry.ConnectionHandle;
import com.talkwire.realtime.registry.ConnectionRegistry;
import com.talkwire.realtime.relay.BroadcastRelay;
import com.talkwire.realtime.room.RoomMembershipIndex;
import com.talkwire.realtime.transport.CloseReason;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Fans events out to live connections.
 * <p>
 * Sends run on snapshots taken from the registry and room index, never under
 * their locks. A connection whose send fails is unregistered and closed at
 * once and is not retried; the identity's other connections still receive
 * the event.
 */
@Slf4j
@Component
public class MessageDispatcher {

    private final ConnectionRegistry registry;
    private final RoomMembershipIndex rooms;
    private final EventCodec codec;
    private final ApplicationEventPublisher eventPublisher;
    private final BroadcastRelay relay;

    @Getter
    private final String instanceId = UUID.randomUUID().toString();

    public MessageDispatcher(ConnectionRegistry registry,
                             RoomMembershipIndex rooms,
                             EventCodec codec,
                             ApplicationEventPublisher eventPublisher,
                             ObjectProvider<BroadcastRelay> relayProvider) {
        this.registry = registry;
        this.rooms = rooms;
        this.codec = codec;
        this.eventPublisher = eventPublisher;
        this.relay = relayProvider.getIfAvailable();
    }

    @PostConstruct
    void subscribeToRelay() {
        if (relay != null) {
            relay.subscribe(this::onRelayedBroadcast);
            log.info("Room broadcast relay enabled: instanceId={}", instanceId);
        }
    }

    /**
     * Sends to every live connection of the user.
     *
     * @return true if at least one connection accepted the event
     */
    public boolean sendToIdentity(Long userId, OutboundEvent event) {
        return deliverToIdentity(userId, codec.encode(event));
    }

    /**
     * Sends to a single connection, e.g. an acknowledgement or an error reply.
     */
    public boolean sendToConnection(String connectionId, OutboundEvent event) {
        return registry.handle(connectionId)
                .map(handle -> trySend(handle, codec.encode(event)))
                .orElse(false);
    }

    /**
     * Sends to every member of the room except {@code excludeUserId}, then hands
     * the broadcast to the relay if one is configured.
     *
     * @return number of members reached on this instance
     */
    public int broadcastToRoom(Long roomId, OutboundEvent event, Long excludeUserId) {
        String payload = codec.encode(event);
        int delivered = deliverToRoom(roomId, payload, excludeUserId);

        if (relay != null) {
            try {
                relay.publish(new RoomBroadcastEvent(instanceId, roomId, excludeUserId, payload));
            } catch (Exception e) {
                log.error("Failed to relay broadcast: roomId={}", roomId, e);
            }
        }
        return delivered;
    }

    void onRelayedBroadcast(RoomBroadcastEvent event) {
        if (event.isFrom(instanceId)) {
            return;
        }
        deliverToRoom(event.getRoomId(), event.getPayload(), event.getExcludeUserId());
    }

    private int deliverToRoom(Long roomId, String payload, Long excludeUserId) {
        Set<Long> members = rooms.membersOf(roomId);
        if (members.isEmpty()) {
            log.debug("Broadcast to room {} skipped: no members", roomId);
            return 0;
        }

        int delivered = 0;
        for (Long userId : members) {
            if (userId.equals(excludeUserId)) {
                continue;
            }
            if (deliverToIdentity(userId, payload)) {
                delivered++;
            }
        }
        log.debug("Broadcast to room {}: {} of {} members reached", roomId, delivered, members.size());
        return delivered;
    }

    private boolean deliverToIdentity(Long userId, String payload) {
        List<ConnectionHandle> handles = registry.handlesOf(userId);
        if (handles.isEmpty()) {
            return false;
        }

        int success = 0;
        for (ConnectionHandle handle : handles) {
            if (trySend(handle, payload)) {
                success++;
            }
        }
        return success > 0;
    }

    private boolean trySend(ConnectionHandle handle, String payload) {
        try {
            handle.transport().send(payload);
            registry.touchActivity(handle.connectionId());
            return true;
        } catch (Exception e) {
            log.warn("Send failed, dropping connection: userId={}, connectionId={}, cause={}",
                    handle.userId(), handle.connectionId(), e.toString());
            drop(handle);
            return false;
        }
    }

    private void drop(ConnectionHandle handle) {
        registry.unregister(handle.connectionId()).ifPresent(disconnection -> {
            handle.transport().close(CloseReason.SEND_FAILED);
            try {
                eventPublisher.publishEvent(new ConnectionDroppedEvent(disconnection, CloseReason.SEND_FAILED));
            } catch (Exception e) {
                log.error("Cleanup after dropped connection failed: connectionId={}", handle.connectionId(), e);
            }
        });
    }
}
