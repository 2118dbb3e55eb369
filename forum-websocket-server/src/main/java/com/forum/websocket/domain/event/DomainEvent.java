package com.forum.websocket.domain.event;

/**
 * Something a user did that may notify other users.
 */
public interface DomainEvent {

    /** Identity that triggered the event; null for system-originated events. */
    String getActorId();
}
