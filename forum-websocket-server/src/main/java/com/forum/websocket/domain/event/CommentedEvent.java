package com.forum.websocket.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentedEvent implements DomainEvent {
    private String threadOwnerId;
    /** Owner of the parent comment; null when the comment is top-level. */
    private String parentOwnerId;
    private String actorId;
    private String actorName;
    private String threadId;
    private String commentId;
    private String threadTitle;

    public boolean isNested() {
        return parentOwnerId != null;
    }
}
