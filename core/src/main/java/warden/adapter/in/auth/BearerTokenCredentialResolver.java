package warden.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.in.TokenManagement;
import warden.core.port.out.UserRepository;
import warden.spi.CredentialResolver;

/**
 * Resolves tokens minted by the token service.
 *
 * <p>A valid token whose subject no longer exists is treated as bad credentials.
 */
@ApplicationScoped
public class BearerTokenCredentialResolver implements CredentialResolver {

    private final TokenManagement tokens;
    private final UserRepository users;

    @Inject
    public BearerTokenCredentialResolver(TokenManagement tokens, UserRepository users) {
        this.tokens = tokens;
        this.users = users;
    }

    @Override
    public String name() {
        return "bearer-token";
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public Uni<User> resolve(String credential) {
        return tokens.verify(credential)
                .flatMap(claims -> users.findByEmail(claims.subject()))
                .map(user -> user.orElseThrow(() -> new AuthException(AuthFailure.INVALID_CREDENTIALS)));
    }
}
