package com.talkwire.realtime.transport;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CloseReason {

    CLIENT_CLOSED(1000, "Client closed"),
    AUTH_FAILED(1008, "Authentication failed"),
    TRANSPORT_ERROR(1011, "Transport error"),
    SEND_FAILED(1011, "Delivery failed"),
    STALE(1001, "Heartbeat timeout"),
    OVERLOADED(1013, "Connection limit reached"),
    SERVER_SHUTDOWN(1001, "Server shutting down");

    private final int code;
    private final String description;
}
