package com.forum.websocket.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * References carried by a notification, plus the deep link a client follows
 * without further lookup.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationContext {

    @Column(name = "ctx_thread_id", length = 100)
    private String threadId;

    @Column(name = "ctx_comment_id", length = 100)
    private String commentId;

    @Column(name = "ctx_message_id", length = 100)
    private String messageId;

    @Column(name = "ctx_from_user_id", length = 100)
    private String fromUserId;

    @Column(name = "ctx_action_url", length = 255)
    private String actionUrl;
}
