package com.forum.websocket.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.websocket.domain.PubSubMessage;
import com.forum.websocket.infrastructure.RealtimeDeliveryChannel;
import com.forum.websocket.infrastructure.RedisPubSubPublisher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Receives pushes relayed by other nodes and hands them to the local
 * delivery channel. Publications from this node are ignored; they were
 * already delivered locally.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "realtime.relay.enabled", havingValue = "true")
public class RedisMessageListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final RedisMessageListenerContainer listenerContainer;
    private final RedisPubSubPublisher publisher;
    private final RealtimeDeliveryChannel deliveryChannel;
    private final ChannelTopic relayTopic = new ChannelTopic(RedisPubSubPublisher.RELAY_CHANNEL);

    public RedisMessageListener(ObjectMapper objectMapper,
                                RedisMessageListenerContainer listenerContainer,
                                RedisPubSubPublisher publisher,
                                RealtimeDeliveryChannel deliveryChannel) {
        this.objectMapper = objectMapper;
        this.listenerContainer = listenerContainer;
        this.publisher = publisher;
        this.deliveryChannel = deliveryChannel;
    }

    @PostConstruct
    public void subscribe() {
        listenerContainer.addMessageListener(this, relayTopic);
        log.info("Subscribed to relay channel: {}, nodeId={}", relayTopic.getTopic(), publisher.getNodeId());
    }

    @PreDestroy
    public void unsubscribe() {
        listenerContainer.removeMessageListener(this, relayTopic);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            PubSubMessage relayed = objectMapper.readValue(body, PubSubMessage.class);

            if (publisher.getNodeId().equals(relayed.getOriginNode())) {
                return;
            }

            int delivered = switch (relayed.getTarget()) {
                case USER -> deliveryChannel.deliverLocally(relayed.getTargetId(), relayed.getPayload());
                case ROOM -> deliveryChannel.deliverToRoomLocally(relayed.getTargetId(), relayed.getPayload());
            };

            log.debug("Relayed push delivered: target={}, targetId={}, sessions={}",
                    relayed.getTarget(), relayed.getTargetId(), delivered);

        } catch (Exception e) {
            log.error("Error processing relayed push: {}", e.getMessage(), e);
        }
    }
}
