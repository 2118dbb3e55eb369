package com.forum.websocket.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.websocket.domain.AuditLog;
import com.forum.websocket.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Kafka consumer for the audit trail
 *
 * Stores every forum event as an {@link AuditLog} row.
 *
 * Enable with: spring.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class AuditTrailConsumer {

    private static final String SOURCE = "forum-events";

    private final ObjectMapper objectMapper;
    private final AuditLogRepository auditLogRepository;

    public AuditTrailConsumer(ObjectMapper objectMapper, AuditLogRepository auditLogRepository) {
        this.objectMapper = objectMapper;
        this.auditLogRepository = auditLogRepository;
        log.info("AuditTrailConsumer initialized - audit logging enabled");
    }

    @KafkaListener(
        topics = "${kafka.topics.forum-events:forum-events}",
        groupId = "audit-trail-consumer",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeForumEvent(String eventJson, Acknowledgment acknowledgment) {
        try {
            AuditLog auditLog = toAuditLog(eventJson);
            auditLogRepository.save(auditLog);

            log.debug("Audit log saved: type={}, entityId={}",
                auditLog.getEventType(), auditLog.getEntityId());

            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("Failed to process audit event", e);
            // Not acknowledged, will be redelivered
            throw new IllegalStateException("Audit processing failed", e);
        }
    }

    AuditLog toAuditLog(String eventJson) throws IOException {
        JsonNode event = objectMapper.readTree(eventJson);

        return AuditLog.builder()
            .eventType(event.path("eventType").asText("UNKNOWN"))
            .timestamp(parseTimestamp(event.path("timestamp").asText(null)))
            .userId(textOrNull(event, "userId"))
            .entityId(firstPresent(event, "entityId", "messageId", "notificationId"))
            .eventData(eventJson)
            .source(SOURCE)
            .build();
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return Instant.now();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable event timestamp, using receive time: {}", value);
            return Instant.now();
        }
    }

    private static String firstPresent(JsonNode event, String... fields) {
        for (String field : fields) {
            String value = textOrNull(event, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode event, String field) {
        JsonNode node = event.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
