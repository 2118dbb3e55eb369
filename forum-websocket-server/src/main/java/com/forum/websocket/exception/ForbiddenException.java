package com.forum.websocket.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ForumException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
