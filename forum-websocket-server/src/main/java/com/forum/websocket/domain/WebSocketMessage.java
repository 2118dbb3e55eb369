package com.forum.websocket.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.forum.websocket.model.MessageView;
import com.forum.websocket.model.NewMessagePayload;
import com.forum.websocket.model.NotificationView;
import com.forum.websocket.model.UserSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSocketMessage {

    private MessageType type;
    private Object data;
    private String error;
    private Instant timestamp;

    public enum MessageType {
        // Client → Server
        JOIN_ROOM("join-room"),
        LEAVE_ROOM("leave-room"),
        SEND_MESSAGE("send-message"),
        HEARTBEAT("heartbeat"),
        PING("ping"),

        // Server → Client
        WELCOME("welcome"),
        NEW_MESSAGE("new-message"),
        MESSAGE_SENT("message-sent"),
        NOTIFICATION("notification"),
        ROOM_JOINED("room-joined"),
        ROOM_LEFT("room-left"),
        HEARTBEAT_ACK("heartbeat-ack"),
        PONG("pong"),
        ERROR("error");

        private final String eventName;

        MessageType(String eventName) {
            this.eventName = eventName;
        }

        @JsonValue
        public String getEventName() {
            return eventName;
        }

        @JsonCreator
        public static MessageType fromEventName(String eventName) {
            for (MessageType type : values()) {
                if (type.eventName.equalsIgnoreCase(eventName)) {
                    return type;
                }
            }
            return null;
        }
    }

    // Factory methods
    public static WebSocketMessage welcome(String sessionId, String userId) {
        return WebSocketMessage.builder()
            .type(MessageType.WELCOME)
            .data(Map.of(
                "sessionId", sessionId,
                "userId", userId
            ))
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage newMessage(MessageView message, UserSummary sender) {
        return WebSocketMessage.builder()
            .type(MessageType.NEW_MESSAGE)
            .data(NewMessagePayload.builder()
                .message(message)
                .sender(sender)
                .build())
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage messageSent(MessageView message) {
        return WebSocketMessage.builder()
            .type(MessageType.MESSAGE_SENT)
            .data(message)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage notification(NotificationView notification) {
        return WebSocketMessage.builder()
            .type(MessageType.NOTIFICATION)
            .data(notification)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage roomJoined(String roomId) {
        return WebSocketMessage.builder()
            .type(MessageType.ROOM_JOINED)
            .data(Map.of("roomId", roomId))
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage roomLeft(String roomId) {
        return WebSocketMessage.builder()
            .type(MessageType.ROOM_LEFT)
            .data(Map.of("roomId", roomId))
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage error(String errorMessage) {
        return WebSocketMessage.builder()
            .type(MessageType.ERROR)
            .error(errorMessage)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage heartbeatAck() {
        return WebSocketMessage.builder()
            .type(MessageType.HEARTBEAT_ACK)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketMessage pong() {
        return WebSocketMessage.builder()
            .type(MessageType.PONG)
            .timestamp(Instant.now())
            .build();
    }
}
