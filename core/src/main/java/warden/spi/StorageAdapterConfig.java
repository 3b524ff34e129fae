package warden.spi;

import java.util.Optional;

/**
 * Configuration access for directory store providers.
 *
 * <p>Providers use this to read their settings without coupling to a specific
 * configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get an optional configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the value if present
     */
    Optional<String> get(String key);

    /**
     * Get an integer configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the value if present
     * @throws StorageProviderException if the value is present but not an integer
     */
    default Optional<Integer> getInt(String key) {
        return get(key).map(value -> {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                throw new StorageProviderException("Invalid integer for " + key + ": " + value, e);
            }
        });
    }
}
