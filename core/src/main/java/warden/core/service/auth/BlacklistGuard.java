package warden.core.service.auth;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.BlacklistConfig;
import warden.core.port.out.TokenBlacklistRepository;

/**
 * Checks and records revoked tokens.
 *
 * <p>Lookups go through two tiers:
 * <ol>
 *   <li><b>Local cache</b> - confirmed revocations only (~1μs)</li>
 *   <li><b>Store</b> - authoritative point lookup</li>
 * </ol>
 *
 * <p>Only positive answers are cached. The blacklist is monotonic, so a cached
 * revocation is never wrong; a negative answer could be, and always goes to the store.
 */
@ApplicationScoped
public class BlacklistGuard {

    private static final Logger LOG = Logger.getLogger(BlacklistGuard.class);

    private final TokenBlacklistRepository repository;
    private final BlacklistConfig config;

    private Cache<String, Instant> revoked;

    @Inject
    public BlacklistGuard(TokenBlacklistRepository repository, BlacklistConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @PostConstruct
    void init() {
        if (!config.cache().enabled()) {
            LOG.info("Blacklist cache disabled");
            return;
        }

        var cacheConfig = config.cache();
        this.revoked = Caffeine.newBuilder()
                .maximumSize(cacheConfig.maxSize())
                .expireAfterWrite(cacheConfig.ttl().toMillis(), TimeUnit.MILLISECONDS)
                .build();

        LOG.infof("Initialized blacklist cache (maxSize: %d, ttl: %s)", cacheConfig.maxSize(), cacheConfig.ttl());
    }

    /**
     * Check whether a token has been revoked.
     *
     * @param token the full token string
     * @return Uni with true if revoked
     */
    public Uni<Boolean> isBlacklisted(String token) {
        if (revoked != null && revoked.getIfPresent(token) != null) {
            LOG.debug("Cache hit: token blacklisted");
            return Uni.createFrom().item(true);
        }

        return repository.isBlacklisted(token).invoke(blacklisted -> {
            if (blacklisted) {
                cache(token, Instant.now());
            }
        });
    }

    /**
     * Record a revocation. Safe to call repeatedly and concurrently for the same token.
     *
     * @param token     the full token string
     * @param expiresAt when the token expires on its own
     * @return Uni with true if this call was the first to record the token
     */
    public Uni<Boolean> record(String token, Instant expiresAt) {
        return repository.blacklist(token, expiresAt).invoke(() -> cache(token, expiresAt));
    }

    /**
     * Remove entries for tokens that have expired on their own.
     *
     * @return Uni with the number of entries removed
     */
    public Uni<Integer> purgeExpired() {
        var now = Instant.now();
        return repository.cleanExpired(now).invoke(removed -> {
            // Entries cached by lookup carry the lookup time, so they are dropped too
            if (revoked != null) {
                revoked.asMap().values().removeIf(expiry -> expiry.isBefore(now));
            }
            if (removed > 0) {
                LOG.infof("Purged %d expired blacklist entries", removed);
            }
        });
    }

    private void cache(String token, Instant expiresAt) {
        if (revoked != null) {
            revoked.put(token, expiresAt);
        }
    }
}
