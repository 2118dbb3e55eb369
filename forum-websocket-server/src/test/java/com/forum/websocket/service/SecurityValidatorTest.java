package com.forum.websocket.service;

import com.forum.websocket.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurityValidatorTest {

    private static final String SECRET = "test-secret-key-for-forum-realtime-tests-0123456789abcdef";

    private final SecurityValidator validator = new SecurityValidator(SECRET, 60_000, new MetricsService());

    @Test
    void acceptsRawTokenAndBearerHeader() {
        String token = validator.generateToken("alice");

        assertThat(validator.authenticate(token)).isEqualTo("alice");
        assertThat(validator.authenticate("Bearer " + token)).isEqualTo("alice");
        assertThat(validator.validateToken(token, "alice")).isTrue();
        assertThat(validator.validateToken(token, "bob")).isFalse();
    }

    @Test
    void rejectsMissingToken() {
        assertThatThrownBy(() -> validator.authenticate(null))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Authorization required");
        assertThatThrownBy(() -> validator.authenticate(" "))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        SecurityValidator other = new SecurityValidator(
                "another-secret-key-for-forum-realtime-tests-9876543210fedcba", 60_000, new MetricsService());
        String foreign = other.generateToken("alice");

        assertThatThrownBy(() -> validator.authenticate(foreign))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid token");
    }

    @Test
    void rejectsExpiredToken() {
        SecurityValidator shortLived = new SecurityValidator(SECRET, -1_000, new MetricsService());
        String expired = shortLived.generateToken("alice");

        assertThatThrownBy(() -> validator.authenticate(expired))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> validator.authenticate("Bearer not-a-jwt"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid token");
        assertThat(validator.validateToken("not-a-jwt", "alice")).isFalse();
    }
}
