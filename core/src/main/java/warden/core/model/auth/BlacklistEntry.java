package warden.core.model.auth;

import java.time.Instant;

/**
 * A revoked token.
 *
 * @param token         the full token string
 * @param expiresAt     when the token itself expires; the entry may be purged after this
 * @param blacklistedAt when the revocation was recorded
 */
public record BlacklistEntry(String token, Instant expiresAt, Instant blacklistedAt) {

    public BlacklistEntry {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
        if (blacklistedAt == null) {
            blacklistedAt = Instant.now();
        }
    }

    public boolean isPurgeable(Instant now) {
        return now.isAfter(expiresAt);
    }
}
