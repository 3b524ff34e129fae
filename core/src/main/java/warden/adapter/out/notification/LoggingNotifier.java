package warden.adapter.out.notification;

import java.util.HashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.config.NotificationConfig;
import warden.core.port.out.Notifier;

/**
 * Notifier that renders the configured templates and logs the delivery.
 *
 * <p>Used when no mail transport bean is present. The rendered body carries the code,
 * so it is only logged at TRACE; INFO lines name the recipient and subject.
 */
@ApplicationScoped
@DefaultBean
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = Logger.getLogger(LoggingNotifier.class);

    private final NotificationConfig config;

    @Inject
    public LoggingNotifier(NotificationConfig config) {
        this.config = config;
    }

    @Override
    public Uni<Void> sendVerificationEmail(String email, String code, Map<String, String> context) {
        return deliver(email, config.verificationSubject(), config.verificationBody(), code, context);
    }

    @Override
    public Uni<Void> sendPasswordResetEmail(String email, String code, Map<String, String> context) {
        return deliver(email, config.resetSubject(), config.resetBody(), code, context);
    }

    private Uni<Void> deliver(String email, String subject, String template, String code, Map<String, String> context) {
        return Uni.createFrom().item(() -> {
            var body = render(template, email, code, context);
            LOG.infof("Email from %s to %s: %s", config.sender(), email, subject);
            LOG.tracef("Email body: %s", body);
            return null;
        });
    }

    static String render(String template, String email, String code, Map<String, String> context) {
        Map<String, String> values = new HashMap<>();
        if (context != null) {
            values.putAll(context);
        }
        values.put("email", email);
        values.put("code", code);

        var rendered = template;
        for (var entry : values.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", entry.getValue() == null ? "" : entry.getValue());
        }
        return rendered;
    }
}
