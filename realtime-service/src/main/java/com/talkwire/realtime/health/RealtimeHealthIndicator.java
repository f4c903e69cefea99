package com.talkwire.realtime.health;

import com.talkwire.realtime.config.RealtimeProperties;
import com.talkwire.realtime.dto.response.RealtimeStatsResponse;
import com.talkwire.realtime.service.RealtimeStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports live connection counts; DOWN once the connection limit is reached.
 */
@Component
@RequiredArgsConstructor
public class RealtimeHealthIndicator implements HealthIndicator {

    private final RealtimeStatsService statsService;
    private final RealtimeProperties properties;

    @Override
    public Health health() {
        RealtimeStatsResponse stats = statsService.getStats();

        Health.Builder builder = stats.totalConnections() < properties.getMaxConnections()
                ? Health.up()
                : Health.down().withDetail("reason", "Connection limit reached");

        return builder
                .withDetail("totalConnections", stats.totalConnections())
                .withDetail("onlineUsers", stats.onlineUsers())
                .withDetail("activeRooms", stats.activeRooms())
                .withDetail("maxConnections", properties.getMaxConnections())
                .build();
    }
}
