package warden.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the token blacklist.
 *
 * <p>The blacklist is append-only from the point of view of the core: entries are
 * only removed by {@link #cleanExpired(Instant)}, once the token they refer to has
 * expired on its own.
 */
public interface TokenBlacklistRepository {

    /**
     * Blacklist a token. Idempotent: re-blacklisting keeps the original entry.
     *
     * <p>Implementations must decide "new or not" atomically, so that of several
     * concurrent calls for one token exactly one sees {@code true}.
     *
     * @param token     the full token string
     * @param expiresAt when the token expires (entry may be purged afterwards)
     * @return Uni with true if this call inserted the entry, false if it already existed
     */
    Uni<Boolean> blacklist(String token, Instant expiresAt);

    /**
     * Point lookup.
     *
     * @return Uni with true if the token is blacklisted
     */
    Uni<Boolean> isBlacklisted(String token);

    /**
     * Purge entries whose token expired before {@code now}.
     *
     * @return Uni with the number of entries removed
     */
    Uni<Integer> cleanExpired(Instant now);
}
