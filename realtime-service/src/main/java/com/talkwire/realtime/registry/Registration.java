package com.talkwire.realtime.registry;

/**
 * Result of {@link ConnectionRegistry#register}. {@code firstConnection} is
 * true when this connection took the user from offline to online.
 */
public record Registration(String connectionId, Long userId, boolean firstConnection) {
}
