package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Token lifetimes.
 *
 * <p>Configuration prefix: {@code warden.auth.tokens}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_AUTH_TOKENS_ACCESS_LIFETIME_MINUTES}</li>
 *   <li>{@code WARDEN_AUTH_TOKENS_REFRESH_LIFETIME_DAYS}</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden.auth.tokens")
public interface TokenConfig {

    /**
     * Access token lifetime in minutes.
     *
     * @return lifetime (default: 3600)
     */
    @WithDefault("3600")
    long accessLifetimeMinutes();

    /**
     * Refresh token lifetime in days.
     *
     * @return lifetime (default: 7)
     */
    @WithDefault("7")
    long refreshLifetimeDays();
}
