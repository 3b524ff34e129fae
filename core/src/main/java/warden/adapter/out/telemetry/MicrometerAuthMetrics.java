package warden.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.auth.AuthFailure;
import warden.core.model.auth.TokenKind;
import warden.core.port.out.AuthMetrics;

/**
 * Micrometer implementation of {@link AuthMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.auth.login} - Login attempts by outcome and failure reason</li>
 *   <li>{@code warden.auth.resolution} - Credential resolutions by resolver and outcome</li>
 *   <li>{@code warden.auth.tokens.issued} - Tokens minted by kind</li>
 *   <li>{@code warden.auth.tokens.revoked} - Tokens blacklisted</li>
 *   <li>{@code warden.auth.api-keys} - API key operations</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordLogin(boolean success, AuthFailure failure) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.login")
                .description("Password login attempts")
                .tag("outcome", success ? "success" : "failure")
                .tag("reason", failure == null ? "none" : tagValue(failure.name()))
                .register(registry)
                .increment();
    }

    @Override
    public void recordResolution(String resolver, boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.resolution")
                .description("Credential resolution attempts")
                .tag("resolver", resolver == null ? "none" : resolver)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenIssued(TokenKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.tokens.issued")
                .description("Tokens issued")
                .tag("kind", kind.claimValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenRevoked() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.tokens.revoked")
                .description("Tokens revoked")
                .register(registry)
                .increment();
    }

    @Override
    public void recordApiKeyOperation(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.api-keys")
                .description("API key operations")
                .tag("operation", operation == null ? "unknown" : operation)
                .register(registry)
                .increment();
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
