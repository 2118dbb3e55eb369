package com.forum.websocket.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationView {
    private UserSummary user;
    private MessageView lastMessage;
    private long unreadCount;
}
