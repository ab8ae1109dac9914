package com.phillippitts.livescribe.config;

import com.phillippitts.livescribe.presentation.websocket.TranscriptionWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the transcription subscriber endpoint at {@value #ENDPOINT}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String ENDPOINT = "/ws/transcription";

    private final TranscriptionWebSocketHandler handler;

    public WebSocketConfig(TranscriptionWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT);
    }
}
