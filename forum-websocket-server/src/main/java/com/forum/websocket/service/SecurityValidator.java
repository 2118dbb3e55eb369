package com.forum.websocket.service;

import com.forum.websocket.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * JWT validation for the REST API and the realtime socket.
 *
 * Tokens are issued by the auth service; the subject claim carries the user id.
 * Expiry is checked by the parser itself.
 */
@Service
@Slf4j
public class SecurityValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Resolve the authenticated user id from a raw token or an
     * {@code Authorization} header value.
     *
     * @throws UnauthorizedException when the token is missing, malformed,
     *                               badly signed or expired
     */
    public String authenticate(String token) {
        if (token == null || token.isBlank()) {
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthorizedException("Authorization required");
        }

        String raw = token.startsWith(BEARER_PREFIX) ? token.substring(BEARER_PREFIX.length()) : token;

        try {
            Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(raw.trim())
                .getPayload();

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                log.warn("Token without subject rejected");
                metricsService.recordAuthenticationAttempt(false);
                throw new UnauthorizedException("Invalid token");
            }

            metricsService.recordAuthenticationAttempt(true);
            return userId;

        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected token: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            throw new UnauthorizedException("Invalid token");
        }
    }

    /**
     * Non-throwing variant for callers that only need a yes/no answer
     */
    public boolean validateToken(String token, String userId) {
        try {
            return authenticate(token).equals(userId);
        } catch (UnauthorizedException e) {
            return false;
        }
    }

    /**
     * Generate a JWT token (for testing/development)
     */
    public String generateToken(String userId) {
        return Jwts.builder()
            .subject(userId)
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
