package atrium.adapter.out.telemetry;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import atrium.spi.SecurityEvent;
import atrium.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code atrium.security.events.total} - Total events by type and severity</li>
 *   <li>{@code atrium.security.rate_limit.exceeded} - Rate limit violations by tier</li>
 *   <li>{@code atrium.security.privacy.denied} - Privacy denials by reason</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("atrium.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .tag("endpoint", event.endpoint())
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            Counter.builder("atrium.security.rate_limit.exceeded")
                    .description("Rate limit violations")
                    .tag("tier", e.tier())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.PrivacyDenied e) {
            Counter.builder("atrium.security.privacy.denied")
                    .description("Privacy denials")
                    .tag("reason", e.reason())
                    .register(registry)
                    .increment();
        }
    }
}
