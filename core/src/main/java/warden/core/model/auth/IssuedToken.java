package warden.core.model.auth;

import java.time.Instant;

/**
 * A freshly signed token.
 *
 * @param token     the opaque signed string handed to the client
 * @param kind      access or refresh
 * @param expiresAt when the token stops validating
 */
public record IssuedToken(String token, TokenKind kind, Instant expiresAt) {

    public IssuedToken {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Token kind cannot be null");
        }
    }
}
