package com.syntharb.config;

import com.syntharb.api.websocket.BroadcastServer;
import com.syntharb.api.websocket.BroadcastSettings;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the {@link BroadcastServer} as a plain WebSocket handler on
 * {@code syntharb.broadcast.path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final BroadcastServer broadcastServer;
    private final BroadcastSettings broadcastSettings;

    public WebSocketConfig(BroadcastServer broadcastServer, BroadcastSettings broadcastSettings) {
        this.broadcastServer = broadcastServer;
        this.broadcastSettings = broadcastSettings;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(broadcastServer, broadcastSettings.getPath())
                .setAllowedOriginPatterns(broadcastSettings.getAllowedOrigin());
    }
}
