package warden.core.model.auth;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored API key metadata.
 *
 * <p>The raw secret is never stored; only its hash is persisted. Callers present
 * {@code publicId + "." + rawSecret} and the record is found by {@code publicId} alone.
 *
 * @param id        record identifier used for rename and delete
 * @param publicId  public half of the presented key, used for lookup
 * @param keyHash   hash of the raw secret
 * @param userId    owning user
 * @param name      display name (may repeat across keys)
 * @param createdAt when the key was issued
 */
public record ApiKeyRecord(UUID id, String publicId, String keyHash, UUID userId, String name, Instant createdAt) {

    public static final String REDACTED = "[REDACTED]";

    public ApiKeyRecord {
        if (id == null) {
            throw new IllegalArgumentException("API key record ID cannot be null");
        }
        if (publicId == null || publicId.isBlank()) {
            throw new IllegalArgumentException("API key public ID cannot be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("API key hash cannot be null or blank");
        }
        if (userId == null) {
            throw new IllegalArgumentException("API key owner cannot be null");
        }
        if (name == null) {
            name = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isOwnedBy(UUID candidate) {
        return userId.equals(candidate);
    }

    public ApiKeyRecord redacted() {
        return new ApiKeyRecord(id, publicId, REDACTED, userId, name, createdAt);
    }

    public ApiKeyRecord rename(String newName) {
        return new ApiKeyRecord(id, publicId, keyHash, userId, newName, createdAt);
    }
}
