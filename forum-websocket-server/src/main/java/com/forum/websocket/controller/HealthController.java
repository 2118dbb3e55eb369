package com.forum.websocket.controller;

import com.forum.websocket.infrastructure.SessionManager;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final SessionManager sessionManager;

    public HealthController(StringRedisTemplate redisTemplate, SessionManager sessionManager) {
        this.redisTemplate = redisTemplate;
        this.sessionManager = sessionManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("activeSessions", sessionManager.getActiveSessionCount());
        response.put("onlineUsers", sessionManager.getOnlineUserCount());

        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            response.put("redis", "connected");
        } catch (Exception e) {
            response.put("redis", "disconnected");
        }

        return response;
    }
}
