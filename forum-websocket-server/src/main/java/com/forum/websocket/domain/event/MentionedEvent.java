package com.forum.websocket.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionedEvent implements DomainEvent {
    @Builder.Default
    private List<String> mentionedUserIds = new ArrayList<>();
    private String actorId;
    private String actorName;
    private String threadId;
    /** Null when the mention is in the thread body itself. */
    private String commentId;
    private String threadTitle;
}
