package com.talkwire.realtime.event;

import java.util.Arrays;
import java.util.Optional;

public enum InboundEventType {
    PING,
    JOIN_ROOM,
    LEAVE_ROOM,
    TYPING,
    MESSAGE,
    READ_RECEIPT,
    REQUEST_SYNC;

    public static Optional<InboundEventType> from(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(value -> value.name().equals(type))
                .findFirst();
    }
}
