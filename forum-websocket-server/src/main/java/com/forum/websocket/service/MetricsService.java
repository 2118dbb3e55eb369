package com.forum.websocket.service;

import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-only metrics.
 *
 * Counters and gauges are kept in memory and written to the log at debug
 * level; nothing is exported to an external registry.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("✅ MetricsService initialized (log-only mode)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} {} = {}", name, tags, count);
    }

    // ===== Gauges =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business metrics =====

    public void recordWebSocketConnection(String userId, boolean success) {
        incrementCounter("websocket.connections", Tags.of("success", String.valueOf(success)));
        log.info("📥 WebSocket connection: userId={}, success={}", userId, success);

        if (success) {
            incrementGauge("active_connections");
        }
    }

    public void recordWebSocketDisconnection(String userId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.info("📤 WebSocket disconnection: userId={}", userId);
    }

    public void recordMessageReceived(String eventType) {
        incrementCounter("websocket.messages.received", Tags.of("type", eventType));
    }

    public void recordPush(String eventType, int deliveredSessions) {
        incrementCounter("realtime.push", Tags.of("type", eventType));
        if (deliveredSessions == 0) {
            incrementCounter("realtime.push.offline", Tags.of("type", eventType));
        }
    }

    public void recordVote(String entityKind, String action) {
        incrementCounter("votes.applied", Tags.of("kind", entityKind, "action", action));
    }

    public void recordVoteRetry(String entityKind) {
        incrementCounter("votes.retries", Tags.of("kind", entityKind));
    }

    public void recordVoteConflict(String entityKind) {
        incrementCounter("votes.conflicts", Tags.of("kind", entityKind));
        log.warn("⚠️ Vote retries exhausted: kind={}", entityKind);
    }

    public void recordNotificationEmitted(String type) {
        incrementCounter("notifications.created", Tags.of("type", type));
    }

    public void recordNotificationSuppressed(String reason) {
        incrementCounter("notifications.suppressed", Tags.of("reason", reason));
    }

    public void recordMessageSent() {
        incrementCounter("messages.sent");
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("authentication.attempts", Tags.of("success", String.valueOf(success)));
        log.debug("🔐 Auth attempt: success={}", success);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType, "component", component));
        log.error("⚠️ Error: type={}, component={}", errorType, component);
    }

    // ===== Utility =====

    /**
     * Current counter value, summed over tags
     */
    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }
}
