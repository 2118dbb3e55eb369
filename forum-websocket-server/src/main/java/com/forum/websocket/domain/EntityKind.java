package com.forum.websocket.domain;

import com.forum.websocket.exception.NotFoundException;

/**
 * The two votable content types.
 */
public enum EntityKind {
    THREAD("threads", "Thread"),
    COMMENT("comments", "Comment");

    private final String pathSegment;
    private final String displayName;

    EntityKind(String pathSegment, String displayName) {
        this.pathSegment = pathSegment;
        this.displayName = displayName;
    }

    public String getPathSegment() {
        return pathSegment;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static EntityKind fromPathSegment(String segment) {
        for (EntityKind kind : values()) {
            if (kind.pathSegment.equalsIgnoreCase(segment)) {
                return kind;
            }
        }
        throw new NotFoundException("Unknown content type: " + segment);
    }
}
