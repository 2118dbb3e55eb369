package com.forum.websocket.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.forum.websocket.domain.Notification;
import com.forum.websocket.domain.NotificationContext;
import com.forum.websocket.domain.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationView {
    private String id;
    private NotificationType type;
    private String title;
    private String body;
    private NotificationContext context;
    private boolean read;
    private Instant readAt;
    private Instant createdAt;

    public static NotificationView from(Notification notification) {
        return NotificationView.builder()
                .id(notification.getId())
                .type(notification.getType())
                .title(notification.getTitle())
                .body(notification.getBody())
                .context(notification.getContext())
                .read(notification.isRead())
                .readAt(notification.getReadAt())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
