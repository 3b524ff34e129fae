package warden.core.port.out;

import java.time.Instant;
import java.util.Map;

import warden.core.model.auth.ApiKeyMaterial;
import warden.core.model.auth.TokenVerification;

/**
 * Port interface for every cryptographic operation the core depends on.
 *
 * <p>Implementations are CPU-bound and synchronous.
 */
public interface CredentialCipher {

    /**
     * Sign a payload into an opaque token string.
     *
     * @param payload   claims to carry
     * @param expiresAt expiry to embed
     * @return the signed token
     */
    String signToken(Map<String, Object> payload, Instant expiresAt);

    /**
     * Check a token's integrity and extract its payload.
     *
     * <p>Implementations should not reject a token for being expired; expiry is
     * judged by the caller from the returned payload.
     */
    TokenVerification verifyToken(String token);

    String hashPassword(String plainPassword);

    /**
     * Check a password against a stored hash.
     *
     * @return true on match
     * @throws warden.core.model.auth.CredentialIntegrityException if the stored hash cannot be decoded
     */
    boolean verifyPassword(String plainPassword, String hashedPassword);

    /**
     * Generate a fresh public ID and raw secret. The public ID never contains {@code '.'}.
     */
    ApiKeyMaterial generateApiKey();

    String hashApiKey(String rawSecret);

    boolean verifyApiKey(String rawSecret, String keyHash);

    /**
     * Generate a code suitable for email verification or password reset.
     */
    String generateOneTimeCode();
}
