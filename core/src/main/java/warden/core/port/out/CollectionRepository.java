package warden.core.port.out;

import java.util.List;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.Collection;
import warden.core.model.account.Graph;

/**
 * Port interface for the collections and graphs provisioned for new accounts.
 */
public interface CollectionRepository {

    Uni<Collection> createCollection(UUID ownerId, String name, String description);

    Uni<Graph> createGraph(UUID collectionId, String name, String description);

    /**
     * Grant a user membership of a collection. Idempotent.
     */
    Uni<Void> addUserToCollection(UUID userId, UUID collectionId);

    Uni<List<Collection>> findByMember(UUID userId);
}
