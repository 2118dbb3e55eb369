package com.forum.websocket.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.forum.websocket.domain.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Populated message as returned by REST reads and carried by realtime pushes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageView {
    private String id;
    private UserSummary sender;
    private UserSummary receiver;
    private String content;
    private String threadId;
    private Message.MessageType messageType;
    private Message.DeliveryState deliveryState;
    private boolean read;
    private Instant readAt;
    private Instant createdAt;
}
