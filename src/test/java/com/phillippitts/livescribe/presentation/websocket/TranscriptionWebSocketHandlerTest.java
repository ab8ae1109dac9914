package com.phillippitts.livescribe.presentation.websocket;

import com.phillippitts.livescribe.config.properties.DistributionProperties;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.service.distribution.DefaultDistributionHub;
import com.phillippitts.livescribe.service.distribution.DistributionHub;
import com.phillippitts.livescribe.service.distribution.SubscriberChannel;
import com.phillippitts.livescribe.service.distribution.TranscriptionMessage;
import com.phillippitts.livescribe.testutil.MutableClock;
import com.phillippitts.livescribe.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptionWebSocketHandlerTest {

    private DefaultDistributionHub hub;
    private TranscriptionWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        hub = new DefaultDistributionHub(new DistributionProperties(), new SyncExecutor(), new MutableClock());
        handler = new TranscriptionWebSocketHandler(hub);
    }

    @Test
    void extractsSessionIdFromQuery() {
        assertThat(TranscriptionWebSocketHandler.sessionIdOf(URI.create("ws://host/ws/transcription?sessionId=abc")))
                .isEqualTo("abc");
        assertThat(TranscriptionWebSocketHandler.sessionIdOf(URI.create("ws://host/ws/transcription"))).isNull();
        assertThat(TranscriptionWebSocketHandler.sessionIdOf(null)).isNull();
    }

    @Test
    void connectionWithoutSessionIdIsClosed() throws Exception {
        WebSocketSession ws = socket("ws://host/ws/transcription");

        handler.afterConnectionEstablished(ws);

        verify(ws).close(any(CloseStatus.class));
        assertThat(ws.getAttributes()).isEmpty();
    }

    @Test
    void connectionToUnknownSessionIsClosed() throws Exception {
        WebSocketSession ws = socket("ws://host/ws/transcription?sessionId=nope");

        handler.afterConnectionEstablished(ws);

        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(ws).close(status.capture());
        assertThat(status.getValue().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
    }

    @Test
    void subscribedClientReceivesJsonAndDetachesOnClose() throws Exception {
        hub.createConnection("s-1");
        WebSocketSession ws = socket("ws://host/ws/transcription?sessionId=s-1");

        handler.afterConnectionEstablished(ws);
        assertThat(hub.subscriberCount("s-1")).isEqualTo(1);

        hub.broadcast("s-1", TranscriptionMessage.status("s-1", SessionStatus.PAUSED, Instant.EPOCH));
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(ws).sendMessage(sent.capture());
        assertThat(sent.getValue().getPayload()).contains("\"type\":\"status\"").contains("PAUSED");

        handler.afterConnectionClosed(ws, CloseStatus.NORMAL);
        assertThat(hub.subscriberCount("s-1")).isZero();
    }

    @Test
    void pongMarksSubscriberActive() throws Exception {
        DistributionHub recordingHub = mock(DistributionHub.class);
        when(recordingHub.subscribe(eq("s-1"), any(SubscriberChannel.class))).thenReturn("sub-1");
        TranscriptionWebSocketHandler pongHandler = new TranscriptionWebSocketHandler(recordingHub);
        WebSocketSession ws = socket("ws://host/ws/transcription?sessionId=s-1");
        pongHandler.afterConnectionEstablished(ws);

        pongHandler.handlePongMessage(ws, new PongMessage());

        verify(recordingHub).touch("sub-1");
    }

    @Test
    void channelPingSendsWebSocketPingFrame() throws Exception {
        WebSocketSession ws = socket("ws://host/ws/transcription?sessionId=s-1");

        new WebSocketSubscriberChannel(ws).ping();

        verify(ws).sendMessage(any(PingMessage.class));
    }

    private static WebSocketSession socket(String uri) {
        WebSocketSession ws = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(ws.getUri()).thenReturn(URI.create(uri));
        when(ws.getAttributes()).thenReturn(attributes);
        when(ws.getId()).thenReturn("ws-1");
        when(ws.isOpen()).thenReturn(true);
        return ws;
    }
}
