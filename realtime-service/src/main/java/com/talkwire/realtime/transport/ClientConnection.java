package com.talkwire.realtime.transport;

import java.io.IOException;

/**
 * One live transport channel to a client. Implementations must allow
 * {@link #send(String)} to be called from several threads.
 */
public interface ClientConnection {

    void send(String payload) throws IOException;

    /**
     * Closes the underlying channel. Closing an already closed channel is a no-op.
     */
    void close(CloseReason reason);
}
