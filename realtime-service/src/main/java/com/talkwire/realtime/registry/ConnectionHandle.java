package com.talkwire.realtime.registry;

import com.talkwire.realtime.transport.ClientConnection;

/**
 * Send-side view of a registered connection, handed out as part of a snapshot.
 */
public record ConnectionHandle(String connectionId, Long userId, ClientConnection transport) {
}
