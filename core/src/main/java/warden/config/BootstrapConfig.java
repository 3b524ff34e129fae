package warden.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for seeding the administrator account.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code warden.bootstrap.enabled} - Seed the admin account at startup (default: false)</li>
 *   <li>{@code warden.bootstrap.admin-email} - Admin login email</li>
 *   <li>{@code warden.bootstrap.admin-password} - Admin password</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_BOOTSTRAP_ENABLED}</li>
 *   <li>{@code WARDEN_BOOTSTRAP_ADMIN_EMAIL}</li>
 *   <li>{@code WARDEN_BOOTSTRAP_ADMIN_PASSWORD}</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden.bootstrap")
public interface BootstrapConfig {

    /**
     * Whether the admin account is seeded on startup.
     *
     * <p>The account is only created when absent; an existing account is left untouched.
     *
     * @return true if bootstrap is enabled
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * @return the admin email, or empty if not configured
     */
    Optional<String> adminEmail();

    /**
     * The admin password. Hashed before storage and never logged.
     *
     * @return the admin password, or empty if not configured
     */
    Optional<String> adminPassword();
}
