package com.talkwire.realtime.registry;

/**
 * Result of the one {@code unregister} call that actually removed a connection.
 *
 * @param lastConnection true when the identity has no live connection left
 */
public record Disconnection(ConnectionSnapshot connection, boolean lastConnection) {

    public Long userId() {
        return connection.userId();
    }
}
