package warden.core.model.account;

import java.util.UUID;

/**
 * Knowledge graph attached to a collection.
 */
public record Graph(UUID id, UUID collectionId, String name, String description) {

    public Graph {
        if (id == null) {
            throw new IllegalArgumentException("Graph ID cannot be null");
        }
        if (collectionId == null) {
            throw new IllegalArgumentException("Graph collection cannot be null");
        }
    }
}
