package com.forum.websocket.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    THREAD_REPLY("thread_reply"),
    COMMENT_REPLY("comment_reply"),
    THREAD_UPVOTE("thread_upvote"),
    COMMENT_UPVOTE("comment_upvote"),
    THREAD_BOOKMARK("thread_bookmark"),
    NEW_MESSAGE("new_message"),
    THREAD_MENTION("thread_mention"),
    COMMENT_MENTION("comment_mention"),
    SYSTEM("system"),
    NEWSLETTER("newsletter");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
