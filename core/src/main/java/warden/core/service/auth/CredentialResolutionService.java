package warden.core.service.auth;

import java.util.Comparator;
import java.util.List;
import java.util.stream.StreamSupport;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.in.CredentialResolution;
import warden.core.port.out.AuthMetrics;
import warden.spi.CredentialResolver;

/**
 * Resolves a presented credential by trying each {@link CredentialResolver} in turn.
 *
 * <p>Resolvers are ordered by descending priority, then by name, so the chain is
 * deterministic. The first success wins. If every resolver fails the caller sees a
 * single {@link AuthFailure#INVALID_CREDENTIALS}, with no hint of which modes were tried
 * or why they failed.
 */
@ApplicationScoped
public class CredentialResolutionService implements CredentialResolution {

    private static final Logger LOG = Logger.getLogger(CredentialResolutionService.class);

    private final List<CredentialResolver> resolvers;
    private final AuthMetrics metrics;

    @Inject
    public CredentialResolutionService(Instance<CredentialResolver> resolvers, AuthMetrics metrics) {
        this(StreamSupport.stream(resolvers.spliterator(), false).toList(), metrics);
    }

    public CredentialResolutionService(List<CredentialResolver> resolvers, AuthMetrics metrics) {
        this.resolvers = resolvers.stream()
                .sorted(Comparator.comparingInt(CredentialResolver::priority)
                        .reversed()
                        .thenComparing(CredentialResolver::name))
                .toList();
        this.metrics = metrics;
        LOG.infof(
                "Credential resolvers (in order): %s",
                this.resolvers.stream().map(CredentialResolver::name).toList());
    }

    @Override
    public Uni<User> authenticate(String credential) {
        if (credential == null || credential.isBlank()) {
            metrics.recordResolution(null, false);
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_CREDENTIALS));
        }
        return attempt(credential, 0);
    }

    @Override
    public User getActiveUser(User user) {
        if (!user.active()) {
            throw new AuthException(AuthFailure.INACTIVE_ACCOUNT);
        }
        return user;
    }

    @Override
    public Uni<User> authenticateActive(String credential) {
        return authenticate(credential).map(this::getActiveUser);
    }

    private Uni<User> attempt(String credential, int index) {
        if (index >= resolvers.size()) {
            metrics.recordResolution(null, false);
            return Uni.createFrom().failure(new AuthException(AuthFailure.INVALID_CREDENTIALS));
        }

        var resolver = resolvers.get(index);
        return Uni.createFrom()
                .deferred(() -> resolver.resolve(credential))
                .invoke(user -> metrics.recordResolution(resolver.name(), true))
                .onFailure()
                .recoverWithUni(failure -> {
                    logFailure(resolver, failure);
                    return attempt(credential, index + 1);
                });
    }

    private void logFailure(CredentialResolver resolver, Throwable failure) {
        if (failure instanceof AuthException authFailure) {
            LOG.debugf("Resolver %s declined credential: %s", resolver.name(), authFailure.failure());
        } else {
            LOG.warnf(failure, "Resolver %s failed unexpectedly", resolver.name());
        }
    }
}
