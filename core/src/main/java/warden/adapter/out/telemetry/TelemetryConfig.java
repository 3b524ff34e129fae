package warden.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Telemetry configuration.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable authentication metrics.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
