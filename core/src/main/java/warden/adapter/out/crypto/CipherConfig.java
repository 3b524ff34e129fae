package warden.adapter.out.crypto;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Credential cipher settings.
 *
 * <p>Configuration prefix: {@code warden.crypto}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_CRYPTO_SIGNING_SECRET} - HMAC secret, at least 32 bytes</li>
 *   <li>{@code WARDEN_CRYPTO_ISSUER}</li>
 *   <li>{@code WARDEN_CRYPTO_BCRYPT_COST}</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden.crypto")
public interface CipherConfig {

    /**
     * Secret used to sign tokens with HS256. Never logged.
     */
    String signingSecret();

    /**
     * @return the {@code iss} claim stamped on every token (default: warden)
     */
    @WithDefault("warden")
    String issuer();

    /**
     * @return BCrypt cost factor, iterations = 2^cost (default: 10)
     */
    @WithDefault("10")
    int bcryptCost();
}
