package warden.core.model.auth;

import java.time.Instant;

/**
 * Decoded, validated token payload.
 *
 * @param subject   the subject email ({@code sub})
 * @param kind      access or refresh ({@code token_type})
 * @param expiresAt token expiry ({@code exp}); always present
 */
public record TokenClaims(String subject, TokenKind kind, Instant expiresAt) {

    public TokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Token kind cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
    }
}
