package com.forum.websocket.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.websocket.domain.SendMessageRequest;
import com.forum.websocket.domain.WebSocketMessage;
import com.forum.websocket.domain.WebSocketSessionWrapper;
import com.forum.websocket.exception.ForumException;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.exception.UnauthorizedException;
import com.forum.websocket.infrastructure.RealtimeDeliveryChannel;
import com.forum.websocket.infrastructure.SessionManager;
import com.forum.websocket.model.MessageView;
import com.forum.websocket.service.MessageService;
import com.forum.websocket.service.MetricsService;
import com.forum.websocket.service.SecurityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Optional;

/**
 * Realtime endpoint: {@code /ws/forum?token=<jwt>}.
 *
 * Authenticates on connect and registers the session for its user. Inbound
 * envelopes are {@code {type, data}}; failures are answered with an
 * {@code error} envelope and the connection stays open.
 */
@Slf4j
@Component
public class ForumWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final SessionManager sessionManager;
    private final RealtimeDeliveryChannel deliveryChannel;
    private final MessageService messageService;
    private final MetricsService metricsService;
    private final SecurityValidator securityValidator;

    public ForumWebSocketHandler(ObjectMapper objectMapper,
                                 SessionManager sessionManager,
                                 RealtimeDeliveryChannel deliveryChannel,
                                 MessageService messageService,
                                 MetricsService metricsService,
                                 SecurityValidator securityValidator) {
        this.objectMapper = objectMapper;
        this.sessionManager = sessionManager;
        this.deliveryChannel = deliveryChannel;
        this.messageService = messageService;
        this.metricsService = metricsService;
        this.securityValidator = securityValidator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String userId;
        try {
            userId = securityValidator.authenticate(extractToken(wsSession));
        } catch (UnauthorizedException e) {
            log.warn("WebSocket authentication failed: wsId={}, reason={}", wsSession.getId(), e.getMessage());
            metricsService.recordWebSocketConnection(null, false);
            sendRaw(wsSession, WebSocketMessage.error("Authentication failed"));
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSessionWrapper wrapper = sessionManager.registerSession(wsSession, userId);
        metricsService.recordWebSocketConnection(userId, true);

        log.info("WebSocket connected: wsId={}, userId={}", wsSession.getId(), userId);
        deliveryChannel.sendToSession(wrapper, WebSocketMessage.welcome(wrapper.getSessionId(), userId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        Optional<WebSocketSessionWrapper> registered = sessionManager.getSession(wsSession.getId());
        if (registered.isEmpty()) {
            log.warn("Message on unregistered session: wsId={}", wsSession.getId());
            return;
        }
        WebSocketSessionWrapper wrapper = registered.get();

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            reply(wrapper, WebSocketMessage.error("Malformed message"));
            return;
        }

        WebSocketMessage.MessageType type = WebSocketMessage.MessageType.fromEventName(envelope.path("type").asText(""));
        JsonNode data = envelope.path("data");
        metricsService.recordMessageReceived(type != null ? type.getEventName() : "unknown");

        if (type == null) {
            reply(wrapper, WebSocketMessage.error("Unknown message type: " + envelope.path("type").asText("")));
            return;
        }

        try {
            switch (type) {
                case JOIN_ROOM -> handleJoinRoom(wrapper, data);
                case LEAVE_ROOM -> handleLeaveRoom(wrapper, data);
                case SEND_MESSAGE -> handleSendMessage(wrapper, data);
                case HEARTBEAT -> {
                    sessionManager.updateHeartbeat(wrapper.getSessionId());
                    reply(wrapper, WebSocketMessage.heartbeatAck());
                }
                case PING -> reply(wrapper, WebSocketMessage.pong());
                default -> reply(wrapper, WebSocketMessage.error("Unsupported message type: " + type.getEventName()));
            }
        } catch (ForumException e) {
            log.debug("Socket request rejected: wsId={}, type={}, reason={}", wsSession.getId(), type, e.getMessage());
            reply(wrapper, WebSocketMessage.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Error handling message: wsId={}, type={}", wsSession.getId(), type, e);
            metricsService.recordError("MESSAGE_PROCESSING_ERROR", "WebSocketHandler");
            reply(wrapper, WebSocketMessage.error("Message processing failed"));
        }
    }

    private void handleJoinRoom(WebSocketSessionWrapper wrapper, JsonNode data) {
        String roomId = roomId(data);
        sessionManager.joinRoom(wrapper.getSessionId(), roomId);
        reply(wrapper, WebSocketMessage.roomJoined(roomId));
    }

    private void handleLeaveRoom(WebSocketSessionWrapper wrapper, JsonNode data) {
        String roomId = roomId(data);
        sessionManager.leaveRoom(wrapper.getSessionId(), roomId);
        reply(wrapper, WebSocketMessage.roomLeft(roomId));
    }

    /**
     * Same pipeline as the REST send; the sender gets the stored message back
     */
    private void handleSendMessage(WebSocketSessionWrapper wrapper, JsonNode data) throws IOException {
        SendMessageRequest request = objectMapper.treeToValue(data, SendMessageRequest.class);
        MessageView sent = messageService.sendMessage(wrapper.getUserId(), request);
        reply(wrapper, WebSocketMessage.messageSent(sent));
    }

    private String roomId(JsonNode data) {
        String roomId = data.isTextual() ? data.asText() : data.path("roomId").asText("");
        if (roomId.isBlank()) {
            throw new InvalidArgumentException("Room ID is required");
        }
        return roomId;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        String userId = sessionManager.getUserId(wsSession.getId());
        if (userId == null) {
            return;
        }

        sessionManager.unregisterSession(wsSession.getId());
        metricsService.recordWebSocketDisconnection(userId);
        log.info("WebSocket closed: wsId={}, userId={}, status={}", wsSession.getId(), userId, status);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "WebSocketHandler");
    }

    private void reply(WebSocketSessionWrapper wrapper, WebSocketMessage message) {
        deliveryChannel.sendToSession(wrapper, message);
    }

    private void sendRaw(WebSocketSession wsSession, WebSocketMessage message) {
        try {
            wsSession.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (IOException e) {
            log.error("Failed to send message to unregistered session: wsId={}", wsSession.getId(), e);
        }
    }

    /**
     * Token from the {@code token} query parameter, falling back to the
     * handshake's {@code Authorization} header
     */
    private String extractToken(WebSocketSession session) {
        if (session.getUri() != null) {
            String token = UriComponentsBuilder.fromUri(session.getUri())
                    .build()
                    .getQueryParams()
                    .getFirst("token");
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        HttpHeaders headers = session.getHandshakeHeaders();
        return headers != null ? headers.getFirst(HttpHeaders.AUTHORIZATION) : null;
    }
}
