package warden.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.account.User;

/**
 * Port for seeding the administrator account.
 *
 * <p>The admin credentials must be provided by the operator via configuration;
 * they are never generated.
 */
public interface BootstrapManagement {

    /**
     * Create the configured admin account as a superuser if it does not exist yet.
     *
     * @return Uni with the admin user if it was created, or empty if it already existed
     * @throws BootstrapException if bootstrap is misconfigured
     */
    Uni<Optional<User>> bootstrap();

    /**
     * Exception thrown when bootstrap fails due to misconfiguration or error.
     */
    class BootstrapException extends RuntimeException {
        public BootstrapException(String message) {
            super(message);
        }

        public BootstrapException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
