package com.talkwire.realtime.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring WebSocket session. The session is
 * expected to be a {@code ConcurrentWebSocketSessionDecorator}.
 */
@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(reason.getCode(), reason.getDescription()));
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
