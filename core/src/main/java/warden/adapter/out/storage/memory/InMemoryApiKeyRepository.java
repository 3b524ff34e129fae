package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.ApiKeyRecord;
import warden.core.port.out.ApiKeyRepository;

/**
 * In-memory implementation of ApiKeyRepository.
 *
 * <p>Data is NOT persisted across restarts.
 *
 * <p>Thread-safety: Uses explicit synchronization to keep the two internal maps
 * consistent during writes.
 */
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<UUID, ApiKeyRecord> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ApiKeyRecord> storageByPublicId = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Void> save(ApiKeyRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                storageById.put(record.id(), record);
                storageByPublicId.put(record.publicId(), record);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findById(UUID id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(id)));
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findByPublicId(String publicId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageByPublicId.get(publicId)));
    }

    @Override
    public Uni<List<ApiKeyRecord>> findByUser(UUID userId) {
        return Uni.createFrom().item(() -> storageById.values().stream()
                .filter(r -> r.isOwnedBy(userId))
                .toList());
    }

    @Override
    public Uni<Boolean> delete(UUID id) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var record = storageById.remove(id);
                if (record != null) {
                    storageByPublicId.remove(record.publicId());
                    return true;
                }
                return false;
            }
        });
    }
}
