package com.forum.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    private String receiverId;
    private String content;
    private String threadId;
    /** "text" (default), "file" or "image". */
    private String messageType;
}
