package warden.spi;

import warden.core.port.out.DirectoryStore;

/**
 * Service Provider Interface for directory store backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/warden.spi.DirectoryStoreProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: warden.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>A directory store must honour the contracts of every repository it exposes; in
 * particular, blacklist inserts are idempotent and email lookups are case-insensitive.
 */
public interface DirectoryStoreProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: warden.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " directory store";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority. The built-in {@code memory} provider uses 0.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (drivers present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the directory store.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param config Access to configuration properties
     * @return the directory store
     * @throws StorageProviderException if initialization fails
     */
    DirectoryStore createDirectoryStore(StorageAdapterConfig config);
}
