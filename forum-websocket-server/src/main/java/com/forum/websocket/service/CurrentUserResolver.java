package com.forum.websocket.service;

import com.forum.websocket.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling user from the {@code Authorization} header of a REST request.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private final SecurityValidator securityValidator;

    /**
     * @throws UnauthorizedException when the header is missing or the token is invalid
     */
    public String resolve(String authorizationHeader) {
        return securityValidator.authenticate(authorizationHeader);
    }
}
