package com.forum.websocket.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ForumException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
