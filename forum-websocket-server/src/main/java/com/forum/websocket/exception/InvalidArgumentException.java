package com.forum.websocket.exception;

import org.springframework.http.HttpStatus;

public class InvalidArgumentException extends ForumException {

    public InvalidArgumentException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
