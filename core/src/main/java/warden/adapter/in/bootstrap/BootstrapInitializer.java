package warden.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.config.BootstrapConfig;
import warden.core.port.in.BootstrapManagement;
import warden.core.port.in.BootstrapManagement.BootstrapException;

/**
 * Seeds the administrator account on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If bootstrap is enabled but the email or password is missing: startup FAILS</li>
 *   <li>If storage is unavailable: startup FAILS</li>
 *   <li>If the account already exists: startup continues</li>
 * </ul>
 *
 * <p>The admin password is never logged.
 */
@ApplicationScoped
public class BootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(BootstrapInitializer.class);
    private static final Logger AUDIT = Logger.getLogger("warden.audit.bootstrap");

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final BootstrapManagement bootstrapService;
    private final BootstrapConfig config;

    @Inject
    public BootstrapInitializer(BootstrapManagement bootstrapService, BootstrapConfig config) {
        this.bootstrapService = bootstrapService;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.debug("Admin bootstrap is disabled");
            return;
        }

        LOG.info("Admin bootstrap is enabled");

        try {
            var created = bootstrapService.bootstrap().await().atMost(STARTUP_TIMEOUT);
            if (created.isPresent()) {
                AUDIT.infof("ADMIN_CREATED userId=%s", created.get().id());
                LOG.infof("Admin account created: %s", created.get().email());
            } else {
                AUDIT.info("ADMIN_SKIPPED reason=already_exists");
                LOG.info("Admin bootstrap skipped: account already exists");
            }
        } catch (BootstrapException e) {
            LOG.errorf("BOOTSTRAP FAILED: %s", e.getMessage());
            throw e;
        } catch (Exception e) {
            LOG.errorf(e, "BOOTSTRAP FAILED: Unexpected error: %s", e.getMessage());
            throw new BootstrapException("Admin bootstrap failed unexpectedly", e);
        }
    }
}
