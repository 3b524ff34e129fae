package warden.core.model.auth;

/**
 * A stored credential could not be interpreted (missing or undecodable password hash).
 *
 * <p>This is an internal fault of the directory, not a user error, and must never be
 * reported as bad credentials.
 */
public class CredentialIntegrityException extends RuntimeException {

    public CredentialIntegrityException(String message) {
        super(message);
    }

    public CredentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
