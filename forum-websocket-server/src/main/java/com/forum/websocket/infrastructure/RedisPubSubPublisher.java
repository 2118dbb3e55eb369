package com.forum.websocket.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.websocket.domain.PubSubMessage;
import com.forum.websocket.domain.WebSocketMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Publishes realtime pushes on a shared Redis channel so that users connected
 * to other nodes receive them too.
 *
 * Enable with: realtime.relay.enabled=true
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "realtime.relay.enabled", havingValue = "true")
public class RedisPubSubPublisher {

    public static final String RELAY_CHANNEL = "realtime:relay";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String nodeId = UUID.randomUUID().toString();

    public RedisPubSubPublisher(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void publishToUser(String userId, WebSocketMessage message) {
        publish(PubSubMessage.Target.USER, userId, message);
    }

    public void publishToRoom(String roomId, WebSocketMessage message) {
        publish(PubSubMessage.Target.ROOM, roomId, message);
    }

    private void publish(PubSubMessage.Target target, String targetId, WebSocketMessage message) {
        try {
            PubSubMessage relayed = PubSubMessage.builder()
                    .target(target)
                    .targetId(targetId)
                    .originNode(nodeId)
                    .payload(message)
                    .timestamp(Instant.now())
                    .build();

            String payload = objectMapper.writeValueAsString(relayed);
            Long subscribers = redisTemplate.convertAndSend(RELAY_CHANNEL, payload);

            log.debug("Relayed push: target={}, targetId={}, type={}, subscribers={}",
                    target, targetId, message.getType(), subscribers);

        } catch (Exception e) {
            log.error("Failed to relay push: target={}, targetId={}", target, targetId, e);
        }
    }
}
