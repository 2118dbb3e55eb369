package com.forum.websocket.domain.event;

import com.forum.websocket.domain.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpvotedEvent implements DomainEvent {
    private EntityKind entityKind;
    private String entityId;
    private String threadId;
    private String ownerId;
    private String actorId;
    private String entityTitle;
}
