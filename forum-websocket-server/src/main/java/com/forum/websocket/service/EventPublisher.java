package com.forum.websocket.service;

import com.forum.websocket.domain.Message;
import com.forum.websocket.domain.Notification;
import com.forum.websocket.domain.VoteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Event Publisher for Kafka (optional)
 *
 * Publishes forum domain events for the audit trail and downstream consumers.
 * Publication is best-effort and never affects the calling operation.
 *
 * Enable with: spring.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    public static final String VOTE_APPLIED = "VOTE_APPLIED";
    public static final String MESSAGE_SENT = "MESSAGE_SENT";
    public static final String MESSAGE_READ = "MESSAGE_READ";
    public static final String NOTIFICATION_CREATED = "NOTIFICATION_CREATED";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.forum-events:forum-events}")
    private String forumEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    /**
     * Publish vote applied event
     */
    public void publishVoteApplied(VoteOutcome outcome, String userId) {
        Map<String, Object> event = baseEvent(VOTE_APPLIED, userId);
        event.put("entityKind", outcome.getEntityKind().name());
        event.put("entityId", outcome.getEntityId());
        event.put("threadId", outcome.getThreadId());
        event.put("action", outcome.getAction().name());
        event.put("upvoteCount", outcome.getUpvoteCount());
        event.put("downvoteCount", outcome.getDownvoteCount());

        publishEvent(outcome.getEntityId(), event, VOTE_APPLIED);
    }

    /**
     * Publish message sent event
     */
    public void publishMessageSent(Message message) {
        Map<String, Object> event = baseEvent(MESSAGE_SENT, message.getSenderId());
        event.put("messageId", message.getId());
        event.put("receiverId", message.getReceiverId());
        event.put("threadId", message.getThreadId());
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);

        publishEvent(message.getId(), event, MESSAGE_SENT);
    }

    /**
     * Publish message read event
     */
    public void publishMessageRead(String userId, String messageId, int count) {
        Map<String, Object> event = baseEvent(MESSAGE_READ, userId);
        event.put("messageId", messageId);
        event.put("count", count);

        publishEvent(userId, event, MESSAGE_READ);
    }

    /**
     * Publish notification created event
     */
    public void publishNotificationCreated(Notification notification) {
        Map<String, Object> event = baseEvent(NOTIFICATION_CREATED, notification.getRecipientUserId());
        event.put("notificationId", notification.getId());
        event.put("notificationType", notification.getType().getWireName());
        if (notification.getContext() != null) {
            event.put("threadId", notification.getContext().getThreadId());
            event.put("messageId", notification.getContext().getMessageId());
        }

        publishEvent(notification.getRecipientUserId(), event, NOTIFICATION_CREATED);
    }

    private Map<String, Object> baseEvent(String eventType, String userId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("userId", userId);
        return event;
    }

    /**
     * Generic event publisher
     */
    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(forumEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published successfully: type={}, topic={}, partition={}, offset={}",
                        eventType, forumEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, forumEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
