package atrium.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import atrium.core.config.MonitoringConfig;
import atrium.core.model.common.RiskLevel;
import atrium.core.port.out.Metrics;

/**
 * Records request-gate metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code atrium.requests.total} - Request count by endpoint, method, status</li>
 *   <li>{@code atrium.requests.latency} - Request latency with published percentiles</li>
 *   <li>{@code atrium.ratelimit.checks} - Rate-limit checks by tier and outcome</li>
 *   <li>{@code atrium.security.findings} - Non-safe security findings by risk level</li>
 *   <li>{@code atrium.privacy.denials} - Privacy denials by reason</li>
 *   <li>{@code atrium.requests.timeouts} - Requests that hit the pipeline timeout</li>
 *   <li>{@code atrium.security.events.dropped} - Security events discarded under backpressure</li>
 * </ul>
 */
@ApplicationScoped
public class AtriumMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public AtriumMetrics(MeterRegistry registry, MonitoringConfig config) {
        this.registry = registry;
        this.enabled = registry != null && config != null && config.metricsEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRequest(String endpoint, String method, int statusCode, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.requests.total")
                .description("Total number of requests processed")
                .tag("endpoint", nullSafe(endpoint))
                .tag("method", nullSafe(method))
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();

        Timer.builder("atrium.requests.latency")
                .description("End-to-end request latency through the pipeline")
                .tag("endpoint", nullSafe(endpoint))
                .tag("status_class", statusClass(statusCode))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRateLimitCheck(String tier, boolean allowed, long remaining) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.ratelimit.checks")
                .description("Rate limit checks")
                .tag("tier", nullSafe(tier))
                .tag("outcome", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSecurityFinding(String endpoint, RiskLevel level, boolean blocked) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.security.findings")
                .description("Non-safe security findings")
                .tag("endpoint", nullSafe(endpoint))
                .tag("risk", level.name().toLowerCase(Locale.ROOT))
                .tag("blocked", String.valueOf(blocked))
                .register(registry)
                .increment();
    }

    @Override
    public void recordPrivacyDenial(String endpoint, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.privacy.denials")
                .description("Profile accesses denied by the privacy engine")
                .tag("endpoint", nullSafe(endpoint))
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTimeout(String endpoint) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.requests.timeouts")
                .description("Requests that exceeded the pipeline timeout")
                .tag("endpoint", nullSafe(endpoint))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSecurityEventDropped(String eventType) {
        if (!enabled) {
            return;
        }

        Counter.builder("atrium.security.events.dropped")
                .description("Security events discarded because the dispatch queue was full")
                .tag("type", nullSafe(eventType))
                .register(registry)
                .increment();
    }

    private static String statusClass(int statusCode) {
        return (statusCode / 100) + "xx";
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
