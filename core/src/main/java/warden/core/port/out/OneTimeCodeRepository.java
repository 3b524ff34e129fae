package warden.core.port.out;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.OneTimeCodePurpose;

/**
 * Port interface for single-use codes (email verification codes, password reset tokens).
 *
 * <p>Each user holds at most one code per purpose: storing a new code supersedes the
 * previous one. Lookups ignore codes whose expiry has passed.
 */
public interface OneTimeCodeRepository {

    /**
     * Store a code for a user, replacing any existing code of the same purpose.
     */
    Uni<Void> store(UUID userId, OneTimeCodePurpose purpose, String code, Instant expiresAt);

    /**
     * Resolve an unexpired code to the user it was issued to.
     *
     * @return Uni with the user ID, or empty if the code is unknown or expired
     */
    Uni<Optional<UUID>> findUserId(OneTimeCodePurpose purpose, String code);

    /**
     * Delete a code by its value.
     *
     * @return Uni with true if a code was removed
     */
    Uni<Boolean> removeByCode(OneTimeCodePurpose purpose, String code);

    /**
     * Delete the code a user holds for a purpose.
     *
     * @return Uni with true if a code was removed
     */
    Uni<Boolean> removeForUser(OneTimeCodePurpose purpose, UUID userId);
}
