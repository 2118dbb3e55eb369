package com.forum.websocket.exception;

import org.springframework.http.HttpStatus;

/**
 * Concurrent modification that could not be resolved by retrying.
 */
public class ConflictException extends ForumException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause);
    }
}
