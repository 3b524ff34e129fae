package warden.core.service.account;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.config.BootstrapConfig;
import warden.core.model.account.User;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.AuthFailure;
import warden.core.port.in.AccountManagement;
import warden.core.port.in.BootstrapManagement;
import warden.core.port.out.UserRepository;

/**
 * Seeds the administrator account.
 *
 * <p>The admin email and password must be provided by the operator via
 * {@code WARDEN_BOOTSTRAP_ADMIN_EMAIL} and {@code WARDEN_BOOTSTRAP_ADMIN_PASSWORD}.
 * The admin is created verified. An existing account with that email is never modified.
 */
@ApplicationScoped
public class AdminBootstrapService implements BootstrapManagement {

    private static final Logger LOG = Logger.getLogger(AdminBootstrapService.class);

    private final BootstrapConfig config;
    private final UserRepository users;
    private final AccountManagement accounts;

    @Inject
    public AdminBootstrapService(BootstrapConfig config, UserRepository users, AccountManagement accounts) {
        this.config = config;
        this.users = users;
        this.accounts = accounts;
    }

    @Override
    public Uni<Optional<User>> bootstrap() {
        var email = config.adminEmail()
                .filter(e -> !e.isBlank())
                .orElseThrow(() -> new BootstrapException("Admin email is required when bootstrap is enabled. "
                        + "Set WARDEN_BOOTSTRAP_ADMIN_EMAIL."));
        var password = config.adminPassword()
                .filter(p -> !p.isBlank())
                .orElseThrow(() -> new BootstrapException("Admin password is required when bootstrap is enabled. "
                        + "Set WARDEN_BOOTSTRAP_ADMIN_PASSWORD."));

        return users.findByEmail(email).flatMap(existing -> {
            if (existing.isPresent()) {
                LOG.infof("Admin account %s already exists", existing.get().id());
                return Uni.createFrom().item(Optional.<User>empty());
            }

            // The operator supplied the address, so there is nobody to confirm it
            return accounts.register(email, password, true)
                    .call(admin -> users.markVerified(admin.id()))
                    .map(admin -> Optional.of(admin.markVerified()))
                    .onFailure(AuthException.class)
                    .recoverWithUni(failure -> {
                        // Another node created the account between the lookup and the insert
                        if (((AuthException) failure).is(AuthFailure.ALREADY_EXISTS)) {
                            LOG.infof("Admin account was created concurrently");
                            return Uni.createFrom().item(Optional.<User>empty());
                        }
                        return Uni.createFrom().<Optional<User>>failure(failure);
                    });
        });
    }
}
