package com.talkwire.realtime.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    @Positive
    private long staleThresholdMs = 60_000;

    @Positive
    private long sweepIntervalMs = 30_000;

    @Positive
    private long typingTtlMs = 5_000;

    @Min(1)
    private int syncLimit = 50;

    @Positive
    private int sendTimeLimitMs = 10_000;

    @Positive
    private int sendBufferSizeLimit = 512 * 1024;

    @Min(1)
    private int maxConnections = 10_000;

    @NotBlank
    private String allowedOrigins = "http://localhost:3000";

    @Valid
    private Relay relay = new Relay();

    @Getter
    @Setter
    public static class Relay {
        private boolean enabled = false;

        @NotBlank
        private String channel = "ws:broadcast:room";
    }
}
