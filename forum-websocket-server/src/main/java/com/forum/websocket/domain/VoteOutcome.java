package com.forum.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of applying a vote: the authoritative counters after the write plus
 * what the caller needs to build a follow-up notification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteOutcome {
    private EntityKind entityKind;
    private String entityId;
    private String threadId;
    private String ownerId;
    private String entityTitle;
    private VoteTransition.Action action;
    private int upvoteCount;
    private int downvoteCount;
    private NotificationHint notificationHint;

    public boolean shouldNotify() {
        return notificationHint == NotificationHint.EMIT_UPVOTE;
    }
}
