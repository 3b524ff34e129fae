package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.BlacklistEntry;
import warden.core.port.out.TokenBlacklistRepository;

/**
 * In-memory implementation of TokenBlacklistRepository.
 *
 * <p>Entries are only removed by {@link #cleanExpired(Instant)}; lookups never evict.
 *
 * <p><strong>Warning:</strong> Revocations are lost on restart and not shared across instances.
 */
public class InMemoryTokenBlacklistRepository implements TokenBlacklistRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenBlacklistRepository.class);

    private final ConcurrentMap<String, BlacklistEntry> entries;

    public InMemoryTokenBlacklistRepository() {
        this(InMemoryUserRepository.DEFAULT_INITIAL_CAPACITY);
    }

    public InMemoryTokenBlacklistRepository(int initialCapacity) {
        this.entries = new ConcurrentHashMap<>(initialCapacity);
    }

    @Override
    public Uni<Boolean> blacklist(String token, Instant expiresAt) {
        return Uni.createFrom()
                .item(() -> entries.putIfAbsent(token, new BlacklistEntry(token, expiresAt, Instant.now())) == null);
    }

    @Override
    public Uni<Boolean> isBlacklisted(String token) {
        return Uni.createFrom().item(() -> entries.containsKey(token));
    }

    @Override
    public Uni<Integer> cleanExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var before = entries.size();
            entries.values().removeIf(entry -> entry.isPurgeable(now));
            var removed = before - entries.size();
            if (removed > 0) {
                LOG.debugf("Purged %d expired blacklist entries", removed);
            }
            return removed;
        });
    }
}
