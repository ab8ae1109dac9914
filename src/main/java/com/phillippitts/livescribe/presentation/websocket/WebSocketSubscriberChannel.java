package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.service.distribution.SubscriberChannel;
import com.phillippitts.livescribe.service.distribution.TranscriptionMessage;
import com.phillippitts.livescribe.service.distribution.TranscriptionMessageSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link SubscriberChannel} over a Spring {@link WebSocketSession}; messages go out as JSON text frames.
 */
final class WebSocketSubscriberChannel implements SubscriberChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketSubscriberChannel.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

    private final WebSocketSession session;

    WebSocketSubscriberChannel(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_BYTES);
    }

    @Override
    public void send(TranscriptionMessage message) throws IOException {
        session.sendMessage(new TextMessage(TranscriptionMessageSerializer.toJson(message)));
    }

    @Override
    public void ping() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOG.debug("Error closing websocket {}: {}", session.getId(), e.toString());
        }
    }
}
