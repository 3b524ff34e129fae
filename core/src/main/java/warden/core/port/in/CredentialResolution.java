package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;

/**
 * Port for turning a presented bearer credential into an authenticated user.
 */
public interface CredentialResolution {

    /**
     * Resolve a credential (access token or API key) to a user.
     *
     * <p>Total: every input yields either a user or a single
     * {@code INVALID_CREDENTIALS} failure, whichever mode was attempted and however it failed.
     *
     * @param credential the credential as received, possibly with a {@code Bearer } prefix
     * @return Uni with the user
     */
    Uni<User> authenticate(String credential);

    /**
     * Guard that the user may act.
     *
     * @param user the authenticated user
     * @return the same user
     * @throws warden.core.model.auth.AuthException with {@code INACTIVE_ACCOUNT} if inactive
     */
    User getActiveUser(User user);

    /**
     * {@link #authenticate(String)} followed by {@link #getActiveUser(User)}.
     */
    Uni<User> authenticateActive(String credential);
}
