package com.forum.websocket.config;

import com.forum.websocket.handler.ForumWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ForumWebSocketHandler forumWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(ForumWebSocketHandler forumWebSocketHandler,
                           @Value("${realtime.allowed-origins:*}") String[] allowedOrigins) {
        this.forumWebSocketHandler = forumWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(forumWebSocketHandler, "/ws/forum")
                .setAllowedOrigins(allowedOrigins);
    }
}
