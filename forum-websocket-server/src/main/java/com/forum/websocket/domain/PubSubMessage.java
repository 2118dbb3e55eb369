package com.forum.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Realtime push relayed between server nodes over Redis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PubSubMessage {
    private Target target;
    /** User id or room id, depending on {@link #target}. */
    private String targetId;
    private String originNode;
    private WebSocketMessage payload;
    private Instant timestamp;

    public enum Target {
        USER,
        ROOM
    }
}
