package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenPair;

/**
 * Port for issuing, verifying, rotating and revoking access and refresh tokens.
 */
public interface TokenManagement {

    /**
     * Mint an access token for a subject.
     *
     * @param subjectEmail the subject's email
     * @return the signed token
     */
    IssuedToken issueAccessToken(String subjectEmail);

    /**
     * Mint a refresh token for a subject.
     *
     * @param subjectEmail the subject's email
     * @return the signed token
     */
    IssuedToken issueRefreshToken(String subjectEmail);

    /**
     * Mint an access and refresh token for a subject.
     */
    TokenPair issuePair(String subjectEmail);

    /**
     * Verify a token.
     *
     * <p>Checks, in order: blacklist ({@code REVOKED}), signature ({@code INVALID_TOKEN}),
     * payload shape ({@code MALFORMED_CLAIMS}), expiry ({@code EXPIRED}).
     *
     * @param token the token string
     * @return Uni with the decoded claims
     */
    Uni<TokenClaims> verify(String token);

    /**
     * Exchange a refresh token for a new pair.
     *
     * <p>The presented refresh token is blacklisted before the new pair is produced;
     * each refresh token can be exchanged at most once.
     *
     * @param refreshToken the refresh token
     * @return Uni with the new pair; fails with {@code WRONG_TOKEN_TYPE} for access tokens
     */
    Uni<TokenPair> refresh(String refreshToken);

    /**
     * Revoke a token. Idempotent, and accepts tokens that would not verify.
     *
     * @param token the token string
     * @return Uni completing when the revocation is durable
     */
    Uni<Void> revoke(String token);

    /**
     * Purge blacklist entries whose token has expired on its own.
     *
     * @return Uni with the number of entries purged
     */
    Uni<Integer> cleanExpiredBlacklistedTokens();
}
