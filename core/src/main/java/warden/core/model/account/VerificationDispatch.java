package warden.core.model.account;

import java.time.Instant;

/**
 * Result of (re)sending a verification email.
 *
 * <p>The code itself is deliberately absent; it only travels through the notifier.
 *
 * @param email     recipient
 * @param expiresAt when the new code stops being accepted
 * @param message   human-readable confirmation
 */
public record VerificationDispatch(String email, Instant expiresAt, String message) {}
