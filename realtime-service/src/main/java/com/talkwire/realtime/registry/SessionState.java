package com.talkwire.realtime.registry;

/**
 * Lifecycle of a registered connection. {@code CONNECTING} is never stored:
 * a connection only enters the registry once it is authenticated.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSING,
    CLOSED
}
