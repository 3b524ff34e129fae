package warden.core.service.auth;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenKind;
import warden.core.model.auth.TokenVerification;
import warden.core.port.out.CredentialCipher;

/**
 * Builds and parses signed token payloads.
 *
 * <p>The codec knows nothing about revocation. Expiry is read from the payload and
 * compared with the wall clock here, whatever the cipher itself enforces.
 */
@ApplicationScoped
public class TokenCodec {

    private static final Logger LOG = Logger.getLogger(TokenCodec.class);

    static final String SUBJECT_CLAIM = "sub";
    static final String TOKEN_TYPE_CLAIM = "token_type";
    static final String EXPIRY_CLAIM = "exp";
    static final String TOKEN_ID_CLAIM = "jti";

    private final CredentialCipher cipher;

    @Inject
    public TokenCodec(CredentialCipher cipher) {
        this.cipher = cipher;
    }

    /**
     * Sign a token for a subject.
     *
     * @param subject   subject email
     * @param kind      access or refresh
     * @param expiresAt expiry to embed
     * @return the issued token
     */
    public IssuedToken encode(String subject, TokenKind kind, Instant expiresAt) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put(SUBJECT_CLAIM, subject);
        payload.put(TOKEN_TYPE_CLAIM, kind.claimValue());
        // Distinguishes tokens minted for the same subject within the same second
        payload.put(TOKEN_ID_CLAIM, UUID.randomUUID().toString());

        return new IssuedToken(cipher.signToken(payload, expiresAt), kind, expiresAt);
    }

    /**
     * Verify the signature and decode the claims of a token.
     *
     * @param token the token string
     * @return the decoded claims
     * @throws AuthException {@code INVALID_TOKEN}, {@code MALFORMED_CLAIMS} or {@code EXPIRED}
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthFailure.INVALID_TOKEN);
        }

        var verification = cipher.verifyToken(token);
        if (verification instanceof TokenVerification.Rejected rejected) {
            LOG.debugf("Token rejected by cipher: %s", rejected.reason());
            throw new AuthException(AuthFailure.INVALID_TOKEN);
        }

        var payload = ((TokenVerification.Verified) verification).payload();
        var subject = payload.get(SUBJECT_CLAIM);
        var kind = TokenKind.fromClaim(payload.get(TOKEN_TYPE_CLAIM));
        var expiresAt = readExpiry(payload);

        if (!(subject instanceof String email) || email.isBlank() || kind.isEmpty() || expiresAt.isEmpty()) {
            throw new AuthException(AuthFailure.MALFORMED_CLAIMS);
        }

        if (expiresAt.get().isBefore(Instant.now())) {
            throw new AuthException(AuthFailure.EXPIRED);
        }

        return new TokenClaims(email, kind.get(), expiresAt.get());
    }

    /**
     * Best-effort read of a token's expiry without judging its validity.
     *
     * @param token the token string
     * @return the expiry if the signature checks out and the payload carries one
     */
    public Optional<Instant> peekExpiry(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        if (cipher.verifyToken(token) instanceof TokenVerification.Verified verified) {
            return readExpiry(verified.payload());
        }
        return Optional.empty();
    }

    private Optional<Instant> readExpiry(Map<String, Object> payload) {
        if (payload.get(EXPIRY_CLAIM) instanceof Number seconds) {
            return Optional.of(Instant.ofEpochSecond(seconds.longValue()));
        }
        return Optional.empty();
    }
}
