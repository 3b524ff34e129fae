package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Account registration and recovery settings.
 *
 * <p>Configuration prefix: {@code warden.auth.registration}
 */
@ConfigMapping(prefix = "warden.auth.registration")
public interface RegistrationConfig {

    /**
     * Whether new accounts must confirm their email before logging in.
     *
     * @return true to require verification (default: false)
     */
    @WithDefault("false")
    boolean requireEmailVerification();

    /**
     * How long an emailed verification code stays valid.
     *
     * @return code TTL (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration verificationCodeTtl();

    /**
     * How long a password reset token stays valid.
     *
     * @return reset token TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration resetTokenTtl();
}
