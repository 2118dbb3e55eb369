package com.forum.websocket.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageSentEvent implements DomainEvent {
    private String receiverId;
    private String senderId;
    private String senderName;
    private String senderUsername;
    private String messageId;

    @Override
    public String getActorId() {
        return senderId;
    }
}
