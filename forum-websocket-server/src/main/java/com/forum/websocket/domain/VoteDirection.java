package com.forum.websocket.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.forum.websocket.exception.InvalidArgumentException;

import java.util.Locale;

public enum VoteDirection {
    UP("up"),
    DOWN("down");

    private final String wireName;

    VoteDirection(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Parses a client supplied direction ("up" / "down", case-insensitive).
     *
     * @throws InvalidArgumentException for anything else, including null
     */
    @JsonCreator
    public static VoteDirection parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (VoteDirection direction : values()) {
                if (direction.wireName.equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new InvalidArgumentException("Invalid vote type: " + value);
    }
}
