package warden.core.port.out;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.TokenKind;

/**
 * Port interface for recording authentication metrics.
 */
public interface AuthMetrics {

    void recordLogin(boolean success, AuthFailure failure);

    /**
     * Record the outcome of resolving a presented credential.
     *
     * @param resolver the resolver that succeeded, or {@code null} if all failed
     * @param success  whether a principal was resolved
     */
    void recordResolution(String resolver, boolean success);

    void recordTokenIssued(TokenKind kind);

    void recordTokenRevoked();

    void recordApiKeyOperation(String operation);

    /**
     * No-op implementation for tests and for when metrics are disabled.
     */
    AuthMetrics NOOP = new AuthMetrics() {
        @Override
        public void recordLogin(boolean success, AuthFailure failure) {}

        @Override
        public void recordResolution(String resolver, boolean success) {}

        @Override
        public void recordTokenIssued(TokenKind kind) {}

        @Override
        public void recordTokenRevoked() {}

        @Override
        public void recordApiKeyOperation(String operation) {}
    };
}
