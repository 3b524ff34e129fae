package warden.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Outbound email templates.
 *
 * <p>Configuration prefix: {@code warden.notifications}
 *
 * <p>Bodies may reference {@code {first_name}}, {@code {code}} and {@code {email}}.
 */
@ConfigMapping(prefix = "warden.notifications")
public interface NotificationConfig {

    @WithDefault("no-reply@warden.local")
    String sender();

    @WithDefault("Verify your email address")
    String verificationSubject();

    @WithDefault("Hi {first_name}, your verification code is {code}. It expires in 24 hours.")
    String verificationBody();

    @WithDefault("Reset your password")
    String resetSubject();

    @WithDefault("Hi {first_name}, use this code to reset your password: {code}. It expires in 1 hour.")
    String resetBody();
}
