package warden.core.model.auth;

import java.util.Map;

/**
 * Result of asking the credential cipher to check a token's signature.
 */
public sealed interface TokenVerification {

    /**
     * Signature and structure are intact.
     *
     * @param payload every claim carried by the token
     */
    record Verified(Map<String, Object> payload) implements TokenVerification {
        public Verified {
            payload = payload == null ? Map.of() : Map.copyOf(payload);
        }
    }

    /**
     * The cipher refused the token (bad signature, malformed serialization, wrong algorithm).
     *
     * @param reason diagnostic detail, for logs only
     */
    record Rejected(String reason) implements TokenVerification {}
}
