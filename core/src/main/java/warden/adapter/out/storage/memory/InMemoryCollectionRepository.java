package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.Collection;
import warden.core.model.account.Graph;
import warden.core.port.out.CollectionRepository;

/**
 * In-memory implementation of CollectionRepository.
 */
public class InMemoryCollectionRepository implements CollectionRepository {

    private final ConcurrentHashMap<UUID, Collection> collections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, Graph> graphs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, Set<UUID>> membership = new ConcurrentHashMap<>();

    @Override
    public Uni<Collection> createCollection(UUID ownerId, String name, String description) {
        return Uni.createFrom().item(() -> {
            var collection = new Collection(UUID.randomUUID(), ownerId, name, description);
            collections.put(collection.id(), collection);
            return collection;
        });
    }

    @Override
    public Uni<Graph> createGraph(UUID collectionId, String name, String description) {
        return Uni.createFrom().item(() -> {
            if (!collections.containsKey(collectionId)) {
                throw new IllegalArgumentException("Unknown collection: " + collectionId);
            }
            var graph = new Graph(UUID.randomUUID(), collectionId, name, description);
            graphs.put(graph.id(), graph);
            return graph;
        });
    }

    @Override
    public Uni<Void> addUserToCollection(UUID userId, UUID collectionId) {
        return Uni.createFrom().item(() -> {
            membership.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(collectionId);
            return null;
        });
    }

    @Override
    public Uni<List<Collection>> findByMember(UUID userId) {
        return Uni.createFrom().item(() -> membership.getOrDefault(userId, Set.of()).stream()
                .map(collections::get)
                .filter(c -> c != null)
                .toList());
    }

    /**
     * Graphs belonging to a collection.
     */
    public List<Graph> graphsOf(UUID collectionId) {
        return graphs.values().stream()
                .filter(g -> g.collectionId().equals(collectionId))
                .toList();
    }
}
