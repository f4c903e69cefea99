package com.talkwire.realtime.scheduler;

import com.talkwire.realtime.config.RealtimeProperties;
import com.talkwire.realtime.dispatch.MessageDispatcher;
import com.talkwire.realtime.event.OutboundEvent;
import com.talkwire.realtime.registry.ConnectionRegistry;
import com.talkwire.realtime.session.SessionLifecycleController;
import com.talkwire.realtime.transport.CloseReason;
import com.talkwire.realtime.typing.TypingKey;
import com.talkwire.realtime.typing.TypingSignalTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Reaps connections without a heartbeat within the stale threshold and
 * broadcasts "typing stopped" for expired typing signals.
 * Runs every 30 seconds by default.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LivenessSweeper {

    private final ConnectionRegistry registry;
    private final TypingSignalTracker typing;
    private final SessionLifecycleController lifecycle;
    private final MessageDispatcher dispatcher;
    private final RealtimeProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{@realtimeProperties.sweepIntervalMs}",
            initialDelayString = "#{@realtimeProperties.sweepIntervalMs}")
    public void sweep() {
        Instant now = clock.instant();
        reapStaleConnections(now);
        expireTypingSignals(now);
    }

    void reapStaleConnections(Instant now) {
        Instant cutoff = now.minusMillis(properties.getStaleThresholdMs());
        List<String> stale = registry.staleConnections(cutoff);
        if (stale.isEmpty()) {
            return;
        }

        log.info("Reaping {} stale connections", stale.size());

        for (String connectionId : stale) {
            try {
                lifecycle.disconnect(connectionId, CloseReason.STALE);
            } catch (Exception e) {
                log.error("Failed to reap stale connection: connectionId={}", connectionId, e);
            }
        }
    }

    void expireTypingSignals(Instant now) {
        List<TypingKey> expired = typing.sweep(now);

        for (TypingKey key : expired) {
            try {
                dispatcher.broadcastToRoom(key.roomId(),
                        OutboundEvent.typing(key.roomId(), key.userId(), false, now), key.userId());
            } catch (Exception e) {
                log.error("Failed to broadcast typing expiry: roomId={}, userId={}", key.roomId(), key.userId(), e);
            }
        }
    }
}
