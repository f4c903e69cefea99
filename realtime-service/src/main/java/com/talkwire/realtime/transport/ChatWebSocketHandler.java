package com.talkwire.realtime.transport;

import com.talkwire.realtime.config.RealtimeProperties;
import com.talkwire.realtime.session.InboundEventHandler;
import com.talkwire.realtime.session.SessionLifecycleController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Entry point for {@code /ws/chat}. The access token is read from the
 * {@code token} query parameter or a bearer Authorization header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID_ATTR = "realtime.connectionId";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionLifecycleController lifecycle;
    private final InboundEventHandler inboundEventHandler;
    private final RealtimeProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());

        lifecycle.open(new WebSocketClientConnection(concurrent), extractToken(session), deviceInfo(session))
                .ifPresent(connectionId -> session.getAttributes().put(CONNECTION_ID_ATTR, connectionId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            return;
        }
        inboundEventHandler.handle(connectionId, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String connectionId = connectionId(session);
        log.warn("WebSocket transport error: sessionId={}, connectionId={}, cause={}",
                session.getId(), connectionId, exception.toString());
        if (connectionId != null) {
            lifecycle.disconnect(connectionId, CloseReason.TRANSPORT_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        if (connectionId != null) {
            log.debug("WebSocket closed by peer: connectionId={}, status={}", connectionId, status);
            lifecycle.disconnect(connectionId, CloseReason.CLIENT_CLOSED);
        }
    }

    private String connectionId(WebSocketSession session) {
        return (String) session.getAttributes().get(CONNECTION_ID_ATTR);
    }

    static String extractToken(WebSocketSession session) {
        if (session.getUri() != null) {
            String token = UriComponentsBuilder.fromUri(session.getUri())
                    .build()
                    .getQueryParams()
                    .getFirst("token");
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        String authorization = session.getHandshakeHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    private static Map<String, String> deviceInfo(WebSocketSession session) {
        Map<String, String> info = new HashMap<>();
        String userAgent = session.getHandshakeHeaders().getFirst(HttpHeaders.USER_AGENT);
        if (userAgent != null) {
            info.put("user_agent", userAgent);
        }
        if (session.getRemoteAddress() != null) {
            info.put("remote_address", session.getRemoteAddress().getHostString());
        }
        return info;
    }
}
