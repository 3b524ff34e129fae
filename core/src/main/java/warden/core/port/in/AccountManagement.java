package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.StatusMessage;
import warden.core.model.account.User;
import warden.core.model.account.VerificationDispatch;
import warden.core.model.auth.TokenPair;

/**
 * Port for the account lifecycle: registration, verification, login, password management
 * and logout.
 */
public interface AccountManagement {

    /**
     * Register a regular account.
     *
     * @see #register(String, String, boolean)
     */
    Uni<User> register(String email, String password);

    /**
     * Register an account.
     *
     * <p>Creates the user, a default collection with its graph, and either emails a
     * verification code or marks the account verified immediately, depending on
     * whether verification is required.
     *
     * @return Uni with the created user; fails with {@code ALREADY_EXISTS} for a taken email
     */
    Uni<User> register(String email, String password, boolean superuser);

    /**
     * Confirm an email address with the code sent at registration.
     *
     * @return Uni with a confirmation; fails with {@code INVALID_CODE}
     */
    Uni<StatusMessage> verifyEmail(String email, String verificationCode);

    /**
     * Issue and email a new verification code, superseding the outstanding one.
     *
     * @return Uni with the dispatch details; fails with {@code USER_NOT_FOUND}
     */
    Uni<VerificationDispatch> resendVerificationEmail(String email);

    /**
     * Authenticate with email and password.
     *
     * <p>An unknown email and a wrong password both fail with {@code INVALID_CREDENTIALS}.
     *
     * @return Uni with a new access and refresh token
     */
    Uni<TokenPair> login(String email, String password);

    /**
     * Exchange a refresh token for a new pair.
     */
    Uni<TokenPair> refreshTokens(String refreshToken);

    /**
     * Change the password of an authenticated user.
     *
     * @return Uni with a confirmation; fails with {@code WRONG_PASSWORD}
     */
    Uni<StatusMessage> changePassword(User user, String currentPassword, String newPassword);

    /**
     * Start a password reset.
     *
     * <p>Returns the same message whether or not the email is registered.
     */
    Uni<StatusMessage> requestPasswordReset(String email);

    /**
     * Complete a password reset.
     *
     * @return Uni with a confirmation; fails with {@code INVALID_OR_EXPIRED_TOKEN}
     */
    Uni<StatusMessage> confirmPasswordReset(String resetToken, String newPassword);

    /**
     * Revoke the presented token.
     */
    Uni<StatusMessage> logout(String token);

    /**
     * Purge blacklist entries for tokens that have expired.
     *
     * @return Uni with the number of entries purged
     */
    Uni<Integer> cleanExpiredBlacklistedTokens();
}
