package com.forum.websocket.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.websocket.domain.WebSocketMessage;
import com.forum.websocket.domain.WebSocketSessionWrapper;
import com.forum.websocket.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.List;

/**
 * Best-effort push to live sessions.
 *
 * A push reaches whatever sessions are open at the moment; offline users
 * simply miss it and catch up through the REST reads. Failures on one session
 * never affect the others, and nothing here throws to the caller.
 */
@Component
@Slf4j
public class RealtimeDeliveryChannel {

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final RedisPubSubPublisher relayPublisher;

    public RealtimeDeliveryChannel(SessionManager sessionManager,
                                   ObjectMapper objectMapper,
                                   MetricsService metricsService,
                                   @Autowired(required = false) RedisPubSubPublisher relayPublisher) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.relayPublisher = relayPublisher;
    }

    /**
     * Push to every session of a user, here and (when relaying) on other nodes.
     *
     * @return number of local sessions the message was handed to
     */
    public int push(String userId, WebSocketMessage message) {
        int delivered = deliverLocally(userId, message);
        if (relayPublisher != null) {
            relayPublisher.publishToUser(userId, message);
        }
        return delivered;
    }

    public int pushToRoom(String roomId, WebSocketMessage message) {
        int delivered = deliverToRoomLocally(roomId, message);
        if (relayPublisher != null) {
            relayPublisher.publishToRoom(roomId, message);
        }
        return delivered;
    }

    public int deliverLocally(String userId, WebSocketMessage message) {
        int delivered = send(sessionManager.getUserSessions(userId), message);
        metricsService.recordPush(eventName(message), delivered);
        if (delivered == 0) {
            log.debug("No live session for push: userId={}, type={}", userId, eventName(message));
        }
        return delivered;
    }

    public int deliverToRoomLocally(String roomId, WebSocketMessage message) {
        int delivered = send(sessionManager.getRoomSessions(roomId), message);
        metricsService.recordPush(eventName(message), delivered);
        return delivered;
    }

    /**
     * Send to a single session, e.g. a reply to the client that made a request
     */
    public boolean sendToSession(WebSocketSessionWrapper wrapper, WebSocketMessage message) {
        try {
            return sendText(wrapper, new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize push: type={}", eventName(message), e);
            return false;
        }
    }

    private int send(List<WebSocketSessionWrapper> sessions, WebSocketMessage message) {
        if (sessions.isEmpty()) {
            return 0;
        }

        TextMessage text;
        try {
            text = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize push: type={}", eventName(message), e);
            return 0;
        }

        int delivered = 0;
        for (WebSocketSessionWrapper wrapper : sessions) {
            if (sendText(wrapper, text)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean sendText(WebSocketSessionWrapper wrapper, TextMessage text) {
        if (!wrapper.getWsSession().isOpen()) {
            sessionManager.unregisterSession(wrapper.getSessionId());
            return false;
        }
        try {
            wrapper.getWsSession().sendMessage(text);
            return true;
        } catch (Exception e) {
            // Includes buffer/time limit overflow, after which the decorator closes the session
            log.warn("Push failed, dropping session: sessionId={}, userId={}, error={}",
                    wrapper.getSessionId(), wrapper.getUserId(), e.getMessage());
            sessionManager.unregisterSession(wrapper.getSessionId());
            return false;
        }
    }

    private static String eventName(WebSocketMessage message) {
        return message.getType() != null ? message.getType().getEventName() : "unknown";
    }
}
