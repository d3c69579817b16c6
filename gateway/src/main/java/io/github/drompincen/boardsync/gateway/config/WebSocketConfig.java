package io.github.drompincen.boardsync.gateway.config;

import io.github.drompincen.boardsync.gateway.websocket.BoardWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final BoardWebSocketHandler handler;
    private final String path;

    public WebSocketConfig(BoardWebSocketHandler handler, @Value("${boardsync.ws.path:/ws}") String path) {
        this.handler = handler;
        this.path = path;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path).setAllowedOrigins("*");
    }
}
