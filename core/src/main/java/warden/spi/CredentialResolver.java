package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;

/**
 * Service Provider Interface for credential resolution strategies.
 *
 * <p>Each implementation understands one kind of bearer credential (signed token,
 * API key, ...) and maps it to a user. Implementations are discovered via CDI and
 * tried in descending {@link #priority()}; the first one that succeeds wins.
 *
 * <h2>Built-in Resolvers</h2>
 * <ul>
 *   <li><b>bearer-token</b> (200): access and refresh tokens minted by this service</li>
 *   <li><b>api-key</b> (100): {@code publicId.secret} API keys</li>
 * </ul>
 *
 * <h2>How to Add a Credential Kind</h2>
 * <ol>
 *   <li>Implement this interface as a CDI bean ({@code @ApplicationScoped})</li>
 *   <li>Return a unique name and a priority</li>
 *   <li>Fail the returned {@link Uni} when the credential is not yours or is invalid</li>
 * </ol>
 *
 * <p>Failure details never reach the caller of the resolution chain; they are
 * collapsed into a single "invalid credentials" outcome.
 */
public interface CredentialResolver {

    /**
     * Unique name identifying this resolver, used for logging and metrics.
     *
     * @return the resolver name (e.g., "bearer-token", "api-key")
     */
    String name();

    /**
     * Priority for ordering (higher = tried first).
     *
     * @return the resolver priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Resolve a credential to a user.
     *
     * @param credential the credential exactly as presented
     * @return Uni with the user, or a failed Uni if this resolver cannot authenticate it
     */
    Uni<User> resolve(String credential);
}
