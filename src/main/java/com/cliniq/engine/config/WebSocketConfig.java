package com.cliniq.engine.config;

import com.cliniq.engine.websocket.QueueUpdatesHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Optional push channel for queue boards: {@code /ws/queue?doctorId=..&date=..}.
 * Polling the queue status endpoints works without it.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final QueueUpdatesHandler queueUpdatesHandler;

    @Value("${engine.websocket.path:/ws/queue}")
    private String path;

    @Value("${engine.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(QueueUpdatesHandler queueUpdatesHandler) {
        this.queueUpdatesHandler = queueUpdatesHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(queueUpdatesHandler, path)
                .setAllowedOrigins(allowedOrigins);
    }
}
