package warden.core.model.auth;

/**
 * Failure kinds surfaced by the credential core.
 *
 * <p>Messages are safe to show to clients. Kinds that share a message
 * ({@link #INVALID_CREDENTIALS}) are deliberately indistinguishable.
 */
public enum AuthFailure {
    INVALID_CREDENTIALS(401, "Incorrect email or password"),
    REVOKED(401, "Token has been invalidated"),
    EXPIRED(401, "Token has expired"),
    MALFORMED_CLAIMS(401, "Invalid token claims"),
    INVALID_TOKEN(401, "Invalid or expired token"),
    WRONG_TOKEN_TYPE(401, "Invalid refresh token"),
    INVALID_FORMAT(401, "Invalid API key format"),
    INVALID_KEY(401, "Invalid API key"),
    INACTIVE_ACCOUNT(401, "User account is inactive"),
    EMAIL_NOT_VERIFIED(401, "Email not verified"),
    INVALID_CODE(400, "Invalid verification code"),
    INVALID_OR_EXPIRED_TOKEN(400, "Invalid or expired reset token"),
    WRONG_PASSWORD(400, "Incorrect current password"),
    ALREADY_EXISTS(409, "User with this email already exists"),
    USER_NOT_FOUND(404, "User not found");

    private final int status;
    private final String defaultMessage;

    AuthFailure(int status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    /**
     * HTTP status a transport adapter should use for this failure.
     */
    public int status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
