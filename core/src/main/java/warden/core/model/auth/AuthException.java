package warden.core.model.auth;

/**
 * Typed failure of a credential or account operation.
 */
public class AuthException extends RuntimeException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure) {
        this(failure, failure.defaultMessage());
    }

    public AuthException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthException(AuthFailure failure, Throwable cause) {
        super(failure.defaultMessage(), cause);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }

    public int status() {
        return failure.status();
    }

    public boolean is(AuthFailure candidate) {
        return failure == candidate;
    }
}
