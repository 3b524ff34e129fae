package warden.adapter.out.storage.memory;

import warden.core.port.out.DirectoryStore;
import warden.spi.DirectoryStoreProvider;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * Default in-memory directory store provider.
 *
 * <p>Data is NOT persisted across restarts. This provider exists as a fallback for
 * development, testing and single-instance deployments.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code warden.storage.memory.initial-capacity} - expected number of users and
 *       blacklisted tokens, used to pre-size the indexes (default 256)</li>
 * </ul>
 */
public class InMemoryDirectoryStoreProvider implements DirectoryStoreProvider {

    static final String INITIAL_CAPACITY_KEY = "warden.storage.memory.initial-capacity";
    static final int DEFAULT_INITIAL_CAPACITY = 256;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory directory store (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority - only used if nothing else available
    }

    @Override
    public DirectoryStore createDirectoryStore(StorageAdapterConfig config) {
        int initialCapacity = config.getInt(INITIAL_CAPACITY_KEY).orElse(DEFAULT_INITIAL_CAPACITY);
        if (initialCapacity < 1) {
            throw new StorageProviderException(INITIAL_CAPACITY_KEY + " must be positive: " + initialCapacity);
        }
        return new InMemoryDirectoryStore(initialCapacity);
    }
}
