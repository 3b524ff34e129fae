package warden.core.port.out;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;

/**
 * Port interface for persistent storage of user accounts.
 *
 * <p>Absence is always reported as an empty {@link Optional}, never as a failure,
 * so that callers can tell "no such user" apart from storage errors.
 */
public interface UserRepository {

    /**
     * Insert a new user.
     *
     * @param user the user to create
     * @return Uni with the stored user; fails with
     *         {@link warden.core.model.auth.AuthFailure#ALREADY_EXISTS} if the email is taken
     */
    Uni<User> create(User user);

    /**
     * Replace an existing user.
     *
     * @param user the updated user
     * @return Uni completing when the update is durable
     */
    Uni<Void> update(User user);

    Uni<Optional<User>> findById(UUID id);

    /**
     * Find a user by email. Matching is case-insensitive.
     */
    Uni<Optional<User>> findByEmail(String email);

    /**
     * Replace the password hash of a user.
     *
     * @return Uni with true if the user existed
     */
    Uni<Boolean> updatePassword(UUID id, String hashedPassword);

    /**
     * Mark the user's email as verified.
     *
     * @return Uni with true if the user existed
     */
    Uni<Boolean> markVerified(UUID id);

    /**
     * Set the expiry of the user's outstanding verification code, leaving every other
     * field as currently stored.
     *
     * @return Uni with true if the user existed
     */
    Uni<Boolean> updateVerificationCodeExpiry(UUID id, Instant expiresAt);

    /**
     * Grant superuser rights.
     *
     * @return Uni with true if the user existed
     */
    Uni<Boolean> markSuperuser(UUID id);
}
