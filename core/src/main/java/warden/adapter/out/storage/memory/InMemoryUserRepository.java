package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.out.UserRepository;

/**
 * In-memory implementation of UserRepository.
 *
 * <p>Users are indexed by ID and by lower-cased email. The email index is claimed
 * with {@code putIfAbsent}, so concurrent registrations of one address cannot both win.
 */
public class InMemoryUserRepository implements UserRepository {

    static final int DEFAULT_INITIAL_CAPACITY = 16;

    private final ConcurrentHashMap<UUID, User> byId;
    private final ConcurrentHashMap<String, UUID> idByEmail;

    public InMemoryUserRepository() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public InMemoryUserRepository(int initialCapacity) {
        this.byId = new ConcurrentHashMap<>(initialCapacity);
        this.idByEmail = new ConcurrentHashMap<>(initialCapacity);
    }

    @Override
    public Uni<User> create(User user) {
        return Uni.createFrom().item(() -> {
            var existing = idByEmail.putIfAbsent(normalize(user.email()), user.id());
            if (existing != null) {
                throw new AuthException(AuthFailure.ALREADY_EXISTS);
            }
            byId.put(user.id(), user);
            return user;
        });
    }

    @Override
    public Uni<Void> update(User user) {
        return Uni.createFrom().item(() -> {
            byId.computeIfPresent(user.id(), (id, current) -> user);
            return null;
        });
    }

    @Override
    public Uni<Optional<User>> findById(UUID id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(byId.get(id)));
    }

    @Override
    public Uni<Optional<User>> findByEmail(String email) {
        return Uni.createFrom().item(() -> {
            if (email == null) {
                return Optional.<User>empty();
            }
            return Optional.ofNullable(idByEmail.get(normalize(email))).map(byId::get);
        });
    }

    @Override
    public Uni<Boolean> updatePassword(UUID id, String hashedPassword) {
        return modify(id, user -> user.withHashedPassword(hashedPassword));
    }

    @Override
    public Uni<Boolean> markVerified(UUID id) {
        return modify(id, User::markVerified);
    }

    @Override
    public Uni<Boolean> updateVerificationCodeExpiry(UUID id, Instant expiresAt) {
        return modify(id, user -> user.withVerificationCodeExpiry(expiresAt));
    }

    @Override
    public Uni<Boolean> markSuperuser(UUID id) {
        return modify(id, User::markSuperuser);
    }

    private Uni<Boolean> modify(UUID id, UnaryOperator<User> change) {
        return Uni.createFrom().item(() -> byId.computeIfPresent(id, (key, user) -> change.apply(user)) != null);
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
