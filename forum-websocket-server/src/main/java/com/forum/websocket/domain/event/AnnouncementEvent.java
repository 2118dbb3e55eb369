package com.forum.websocket.domain.event;

import com.forum.websocket.domain.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * System or newsletter notice addressed to a single user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnouncementEvent implements DomainEvent {
    private String recipientId;
    private NotificationType type;
    private String title;
    private String body;
    private String actionUrl;

    @Override
    public String getActorId() {
        return null;
    }
}
