package com.forum.websocket.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for failures that surface to the caller with a definite status.
 */
@Getter
public abstract class ForumException extends RuntimeException {

    private final HttpStatus status;

    protected ForumException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ForumException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
