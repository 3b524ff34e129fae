package warden.core.service.auth;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.BlacklistConfig;
import warden.core.config.TokenConfig;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenKind;
import warden.core.model.auth.TokenPair;
import warden.core.port.in.TokenManagement;
import warden.core.port.out.AuthMetrics;

/**
 * Issues, verifies, rotates and revokes tokens.
 *
 * <p>Verification consults the blacklist before the signature, so a revoked token is
 * turned away on the cheapest path even while it is still cryptographically valid.
 */
@ApplicationScoped
public class TokenService implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenService.class);
    private static final Logger AUDIT = Logger.getLogger("warden.audit.auth");

    private final TokenCodec codec;
    private final BlacklistGuard blacklist;
    private final TokenConfig tokenConfig;
    private final BlacklistConfig blacklistConfig;
    private final AuthMetrics metrics;

    @Inject
    public TokenService(
            TokenCodec codec,
            BlacklistGuard blacklist,
            TokenConfig tokenConfig,
            BlacklistConfig blacklistConfig,
            AuthMetrics metrics) {
        this.codec = codec;
        this.blacklist = blacklist;
        this.tokenConfig = tokenConfig;
        this.blacklistConfig = blacklistConfig;
        this.metrics = metrics;
    }

    @Override
    public IssuedToken issueAccessToken(String subjectEmail) {
        var expiresAt = Instant.now().plus(Duration.ofMinutes(tokenConfig.accessLifetimeMinutes()));
        var token = codec.encode(subjectEmail, TokenKind.ACCESS, expiresAt);
        metrics.recordTokenIssued(TokenKind.ACCESS);
        return token;
    }

    @Override
    public IssuedToken issueRefreshToken(String subjectEmail) {
        var expiresAt = Instant.now().plus(Duration.ofDays(tokenConfig.refreshLifetimeDays()));
        var token = codec.encode(subjectEmail, TokenKind.REFRESH, expiresAt);
        metrics.recordTokenIssued(TokenKind.REFRESH);
        return token;
    }

    @Override
    public TokenPair issuePair(String subjectEmail) {
        return new TokenPair(issueAccessToken(subjectEmail), issueRefreshToken(subjectEmail));
    }

    @Override
    public Uni<TokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_TOKEN));
        }

        return blacklist.isBlacklisted(token).map(blacklisted -> {
            if (blacklisted) {
                throw new AuthException(AuthFailure.REVOKED);
            }
            return codec.decode(token);
        });
    }

    @Override
    public Uni<TokenPair> refresh(String refreshToken) {
        return verify(refreshToken).flatMap(claims -> {
            if (claims.kind() != TokenKind.REFRESH) {
                return Uni.createFrom().<TokenPair>failure(new AuthException(AuthFailure.WRONG_TOKEN_TYPE));
            }

            // The old token must be durably blacklisted before the new pair exists.
            // Only the caller whose insert was new may rotate.
            return blacklist.record(refreshToken, claims.expiresAt()).map(first -> {
                if (!first) {
                    LOG.debugf("Refresh token for %s was already rotated", claims.subject());
                    throw new AuthException(AuthFailure.REVOKED);
                }
                var pair = issuePair(claims.subject());
                LOG.debugf("Rotated refresh token for %s", claims.subject());
                return pair;
            });
        });
    }

    @Override
    public Uni<Void> revoke(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().voidItem();
        }

        var expiresAt = codec.peekExpiry(token)
                .orElseGet(() -> Instant.now().plus(blacklistConfig.defaultRetention()));

        return blacklist.record(token, expiresAt)
                .invoke(() -> {
                    metrics.recordTokenRevoked();
                    AUDIT.infof("TOKEN_REVOKED expiresAt=%s", expiresAt);
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Integer> cleanExpiredBlacklistedTokens() {
        return blacklist.purgeExpired();
    }
}
