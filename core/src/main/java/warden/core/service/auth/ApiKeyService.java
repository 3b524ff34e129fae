package warden.core.service.auth;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.account.User;
import warden.core.model.auth.ApiKeyCreateResult;
import warden.core.model.auth.ApiKeyRecord;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.in.ApiKeyManagement;
import warden.core.port.out.ApiKeyRepository;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.CredentialCipher;
import warden.core.port.out.UserRepository;

/**
 * Service for managing API keys owned by users.
 *
 * <p>Handles key generation, hashing, verification, renaming and deletion. Only the hash
 * of the secret half is stored; the composite key is returned once, at creation.
 */
@ApplicationScoped
public class ApiKeyService implements ApiKeyManagement {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);
    private static final Logger AUDIT = Logger.getLogger("warden.audit.auth");
    private static final char SEPARATOR = '.';

    private final ApiKeyRepository repository;
    private final UserRepository users;
    private final CredentialCipher cipher;
    private final AuthMetrics metrics;

    @Inject
    public ApiKeyService(
            ApiKeyRepository repository, UserRepository users, CredentialCipher cipher, AuthMetrics metrics) {
        this.repository = repository;
        this.users = users;
        this.cipher = cipher;
        this.metrics = metrics;
    }

    @Override
    public Uni<ApiKeyCreateResult> issue(UUID userId, String name) {
        if (userId == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("User ID cannot be null"));
        }

        return Uni.createFrom().deferred(() -> {
            var material = cipher.generateApiKey();
            var record = new ApiKeyRecord(
                    UUID.randomUUID(),
                    material.publicId(),
                    cipher.hashApiKey(material.rawSecret()),
                    userId,
                    name,
                    Instant.now());

            return repository
                    .save(record)
                    .replaceWith(new ApiKeyCreateResult(
                            record.id(), record.publicId(), material.compositeKey(), record.name()))
                    .invoke(() -> {
                        metrics.recordApiKeyOperation("issue");
                        AUDIT.infof(
                                "API_KEY_ISSUED userId=%s keyId=%s publicId=%s", userId, record.id(), record.publicId());
                    });
        });
    }

    @Override
    public Uni<User> verify(String compositeKey) {
        var separator = compositeKey == null ? -1 : compositeKey.indexOf(SEPARATOR);
        if (separator <= 0 || separator == compositeKey.length() - 1) {
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_FORMAT));
        }

        var publicId = compositeKey.substring(0, separator);
        var rawSecret = compositeKey.substring(separator + 1);

        return repository.findByPublicId(publicId).flatMap(found -> {
            // Unknown key and wrong secret are indistinguishable to the caller
            if (found.isEmpty() || !cipher.verifyApiKey(rawSecret, found.get().keyHash())) {
                LOG.debugf("API key rejected (publicId: %s)", publicId);
                return Uni.createFrom().<User>failure(new AuthException(AuthFailure.INVALID_KEY));
            }
            return users.findById(found.get().userId()).map(this::requireActiveOwner);
        });
    }

    @Override
    public Uni<List<ApiKeyRecord>> list(UUID userId) {
        return repository.findByUser(userId).map(keys -> keys.stream()
                .map(ApiKeyRecord::redacted)
                .sorted(Comparator.comparing(ApiKeyRecord::createdAt).reversed())
                .toList());
    }

    @Override
    public Uni<Boolean> rename(UUID userId, UUID keyId, String newName) {
        return findOwned(userId, keyId).flatMap(owned -> {
            if (owned.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            return repository.save(owned.get().rename(newName)).replaceWith(true);
        });
    }

    @Override
    public Uni<Boolean> delete(UUID userId, UUID keyId) {
        return findOwned(userId, keyId).flatMap(owned -> {
            if (owned.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            return repository.delete(keyId).invoke(deleted -> {
                if (deleted) {
                    metrics.recordApiKeyOperation("delete");
                    AUDIT.infof("API_KEY_DELETED userId=%s keyId=%s", userId, keyId);
                }
            });
        });
    }

    /**
     * Look up a key, hiding keys owned by someone else.
     */
    private Uni<Optional<ApiKeyRecord>> findOwned(UUID userId, UUID keyId) {
        if (userId == null || keyId == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(keyId).map(found -> found.filter(key -> key.isOwnedBy(userId)));
    }

    private User requireActiveOwner(Optional<User> owner) {
        if (owner.isEmpty()) {
            LOG.warn("API key references a user that no longer exists");
            throw new AuthException(AuthFailure.INVALID_KEY);
        }
        if (!owner.get().active()) {
            throw new AuthException(AuthFailure.INACTIVE_ACCOUNT);
        }
        return owner.get();
    }
}
