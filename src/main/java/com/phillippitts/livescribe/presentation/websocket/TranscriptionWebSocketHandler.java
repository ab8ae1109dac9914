package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.service.distribution.DistributionHub;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

/**
 * Attaches WebSocket clients to a session's distribution channel.
 *
 * <p>Clients connect to {@code /ws/transcription?sessionId=...}. Pongs answering the hub's
 * heartbeat pings and any inbound text frame count as keep-alives; text payloads are otherwise
 * ignored.
 */
@Component
public class TranscriptionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWebSocketHandler.class);

    static final String SESSION_PARAM = "sessionId";
    static final String SUBSCRIBER_ATTR = "livescribe.subscriberId";

    private final DistributionHub hub;

    public TranscriptionWebSocketHandler(DistributionHub hub) {
        this.hub = Objects.requireNonNull(hub, "hub must not be null");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String sessionId = sessionIdOf(session.getUri());
        if (sessionId == null || sessionId.isBlank()) {
            LOG.warn("WebSocket {} rejected: missing {} parameter", session.getId(), SESSION_PARAM);
            session.close(CloseStatus.BAD_DATA.withReason("sessionId query parameter required"));
            return;
        }
        try {
            String subscriberId = hub.subscribe(sessionId, new WebSocketSubscriberChannel(session));
            session.getAttributes().put(SUBSCRIBER_ATTR, subscriberId);
        } catch (IllegalStateException e) {
            LOG.warn("WebSocket {} rejected: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("unknown or closed session"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String subscriberId = subscriberIdOf(session);
        if (subscriberId != null) {
            hub.touch(subscriberId);
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        String subscriberId = subscriberIdOf(session);
        if (subscriberId != null) {
            hub.touch(subscriberId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("WebSocket {} transport error: {}", session.getId(), exception.toString());
        detach(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        LOG.debug("WebSocket {} closed: {}", session.getId(), status);
        detach(session);
    }

    private void detach(WebSocketSession session) {
        String subscriberId = subscriberIdOf(session);
        if (subscriberId != null) {
            hub.unsubscribe(subscriberId);
        }
    }

    private static String subscriberIdOf(WebSocketSession session) {
        Object id = session.getAttributes().get(SUBSCRIBER_ATTR);
        return id instanceof String s ? s : null;
    }

    static String sessionIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_PARAM);
    }
}
