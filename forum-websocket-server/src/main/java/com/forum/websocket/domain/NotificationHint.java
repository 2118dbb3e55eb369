package com.forum.websocket.domain;

/**
 * Signal from vote application telling the caller whether a notification should follow.
 */
public enum NotificationHint {
    NONE,
    EMIT_UPVOTE
}
