package warden.core.port.out;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.ApiKeyRecord;

/**
 * Port interface for persistent storage of API key records.
 *
 * <p>All implementations must provide durable persistence; an API key lives until
 * its owner deletes it.
 */
public interface ApiKeyRepository {

    /**
     * Save or update an API key record.
     *
     * @param record the record to persist
     * @return Uni completing when save is durable
     */
    Uni<Void> save(ApiKeyRecord record);

    /**
     * Find a record by its record identifier.
     */
    Uni<Optional<ApiKeyRecord>> findById(UUID id);

    /**
     * Find a record by the public half of the presented key.
     *
     * <p>Used during authentication.
     */
    Uni<Optional<ApiKeyRecord>> findByPublicId(String publicId);

    /**
     * Retrieve all keys owned by a user.
     */
    Uni<List<ApiKeyRecord>> findByUser(UUID userId);

    /**
     * Delete a record.
     *
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(UUID id);
}
