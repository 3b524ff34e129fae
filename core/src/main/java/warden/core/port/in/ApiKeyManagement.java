package warden.core.port.in;

import java.util.List;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;
import warden.core.model.auth.ApiKeyCreateResult;
import warden.core.model.auth.ApiKeyRecord;

/**
 * Port for managing user-owned API keys.
 *
 * <p>Keys are presented as {@code publicId.rawSecret}. Only a hash of the secret is stored;
 * the composite key is returned once, at creation.
 *
 * <p>Every operation taking a {@code userId} is scoped to that owner. A key that exists
 * but belongs to someone else is reported exactly like a missing key.
 */
public interface ApiKeyManagement {

    /**
     * Issue a new API key.
     *
     * @param userId owning user
     * @param name   optional display name
     * @return Uni with the one-time result holding the composite key
     */
    Uni<ApiKeyCreateResult> issue(UUID userId, String name);

    /**
     * Resolve a presented composite key to its owner.
     *
     * @param compositeKey {@code publicId.rawSecret}
     * @return Uni with the owning user; fails with {@code INVALID_FORMAT}, {@code INVALID_KEY}
     *         or {@code INACTIVE_ACCOUNT}
     */
    Uni<User> verify(String compositeKey);

    /**
     * List a user's keys with hashes redacted.
     */
    Uni<List<ApiKeyRecord>> list(UUID userId);

    /**
     * Rename a key.
     *
     * @return Uni with true if the key exists and is owned by the user
     */
    Uni<Boolean> rename(UUID userId, UUID keyId, String newName);

    /**
     * Delete a key.
     *
     * @return Uni with true if the key existed, was owned by the user and was removed
     */
    Uni<Boolean> delete(UUID userId, UUID keyId);
}
