package com.talkwire.realtime.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talkwire.common.event.RoomBroadcastEvent;
import com.talkwire.realtime.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Redis Pub/Sub relay. Every instance publishes its room broadcasts to one
 * channel and hands what it receives to its local dispatcher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "realtime.relay", name = "enabled", havingValue = "true")
public class RedisBroadcastRelay implements BroadcastRelay {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RealtimeProperties properties;

    private final List<Consumer<RoomBroadcastEvent>> handlers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(RoomBroadcastEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(properties.getRelay().getChannel(), json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize room broadcast: roomId={}", event.getRoomId(), e);
        }
    }

    @Override
    public void subscribe(Consumer<RoomBroadcastEvent> handler) {
        handlers.add(handler);
    }

    /**
     * Called by Redis MessageListenerAdapter when a message arrives.
     */
    public void onMessage(String message) {
        RoomBroadcastEvent event;
        try {
            event = objectMapper.readValue(message, RoomBroadcastEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize room broadcast: {}", message, e);
            return;
        }

        for (Consumer<RoomBroadcastEvent> handler : handlers) {
            try {
                handler.accept(event);
            } catch (Exception e) {
                log.error("Relay handler failed: roomId={}, eventId={}", event.getRoomId(), event.getEventId(), e);
            }
        }
    }
}
