package warden.core.model.account;

/**
 * Outcome of an account operation that has no payload beyond a human-readable message.
 *
 * @param message the message shown to the caller
 */
public record StatusMessage(String message) {

    public static final String PASSWORD_RESET_REQUESTED = "If the email exists, a reset link has been sent";

    public StatusMessage {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message cannot be null or blank");
        }
    }

    public static StatusMessage of(String message) {
        return new StatusMessage(message);
    }
}
