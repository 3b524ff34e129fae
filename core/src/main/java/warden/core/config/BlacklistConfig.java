package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Token blacklist settings.
 *
 * <p>Configuration prefix: {@code warden.auth.blacklist}
 *
 * <p>The store is authoritative. A local cache holds confirmed revocations only;
 * since a revoked token never becomes valid again, a cached positive can never be stale.
 */
@ConfigMapping(prefix = "warden.auth.blacklist")
public interface BlacklistConfig {

    /**
     * Retention for revoked tokens whose expiry cannot be read.
     *
     * @return retention (default: 7 days, the default refresh lifetime)
     */
    @WithDefault("P7D")
    Duration defaultRetention();

    /**
     * Local cache configuration.
     */
    CacheConfig cache();

    /**
     * Local LRU cache for confirmed revocations.
     */
    interface CacheConfig {

        /**
         * @return true if the local cache is enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return maximum cached revocations (default: 10,000)
         */
        @WithDefault("10000")
        int maxSize();

        /**
         * @return cache entry TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration ttl();
    }
}
