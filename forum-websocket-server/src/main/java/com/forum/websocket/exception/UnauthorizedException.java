package com.forum.websocket.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ForumException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
