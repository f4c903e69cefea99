package com.talkwire.realtime.registry;

import java.time.Instant;

/**
 * Derived presence of an identity. {@link #online()} is computed from the
 * connection count and cannot be set on its own.
 */
public record PresenceRecord(Long userId, int connectionCount, Instant lastSeen) {

    public static PresenceRecord unknown(Long userId) {
        return new PresenceRecord(userId, 0, null);
    }

    public boolean online() {
        return connectionCount > 0;
    }
}
