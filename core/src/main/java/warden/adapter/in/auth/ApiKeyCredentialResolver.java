package warden.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;
import warden.core.port.in.ApiKeyManagement;
import warden.spi.CredentialResolver;

/**
 * Resolves {@code publicId.secret} API keys.
 *
 * <p>Accepts the key with or without a {@code Bearer } scheme marker.
 */
@ApplicationScoped
public class ApiKeyCredentialResolver implements CredentialResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiKeyManagement apiKeys;

    @Inject
    public ApiKeyCredentialResolver(ApiKeyManagement apiKeys) {
        this.apiKeys = apiKeys;
    }

    @Override
    public String name() {
        return "api-key";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public Uni<User> resolve(String credential) {
        var key = credential.startsWith(BEARER_PREFIX)
                ? credential.substring(BEARER_PREFIX.length()).trim()
                : credential;
        return apiKeys.verify(key);
    }
}
