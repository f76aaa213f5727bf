package atrium.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for request monitoring, retention and health classification.
 *
 * <p>Configuration prefix: {@code atrium.monitoring}
 */
@ConfigMapping(prefix = "atrium.monitoring")
public interface MonitoringConfig {

    /**
     * @return whether Micrometer metrics are recorded (default: true)
     */
    @WithName("metrics-enabled")
    @WithDefault("true")
    boolean metricsEnabled();

    /**
     * @return whether security events are dispatched to handlers (default: true)
     */
    @WithName("security-events-enabled")
    @WithDefault("true")
    boolean securityEventsEnabled();

    /**
     * Events waiting for the handler thread. Events published while the queue is full are
     * dropped and counted.
     *
     * @return pending security event capacity (default: 1024)
     */
    @WithName("security-event-queue-capacity")
    @WithDefault("1024")
    int securityEventQueueCapacity();

    /**
     * Hard cap on raw log entries held in memory. Oldest entries are dropped first.
     *
     * @return maximum raw entries (default: 10000)
     */
    @WithName("max-raw-entries")
    @WithDefault("10000")
    int maxRawEntries();

    /**
     * @return age after which raw entries are folded into hourly aggregates (default: 2h)
     */
    @WithName("raw-retention")
    @WithDefault("2h")
    Duration rawRetention();

    /**
     * @return age after which hourly aggregates are folded into daily ones (default: 48h)
     */
    @WithName("hourly-retention")
    @WithDefault("48h")
    Duration hourlyRetention();

    /**
     * @return age after which daily aggregates are dropped (default: 7d)
     */
    @WithName("daily-retention")
    @WithDefault("7d")
    Duration dailyRetention();

    /**
     * @return interval between rollup runs (default: 60s)
     */
    @WithName("rollup-interval")
    @WithDefault("60s")
    Duration rollupInterval();

    /**
     * @return length of the live window used for health summaries (default: 1h)
     */
    @WithName("health-window")
    @WithDefault("1h")
    Duration healthWindow();

    /**
     * @return latency samples kept per endpoint for live p95 (default: 512)
     */
    @WithName("reservoir-size")
    @WithDefault("512")
    int reservoirSize();

    /**
     * Error rate at or above which health is degraded; twice this is unhealthy.
     *
     * @return error rate threshold (default: 0.10)
     */
    @WithName("error-rate-threshold")
    @WithDefault("0.10")
    double errorRateThreshold();

    /**
     * p95 latency at or above which health is degraded; twice this is unhealthy.
     *
     * @return latency threshold (default: 5s)
     */
    @WithName("latency-threshold")
    @WithDefault("5s")
    Duration latencyThreshold();

    /**
     * @return requests slower than this are logged at WARN (default: 5s)
     */
    @WithName("slow-request-threshold")
    @WithDefault("5s")
    Duration slowRequestThreshold();

    /**
     * Field names redacted in addition to the built-in set.
     */
    @WithName("sensitive-fields")
    Optional<List<String>> sensitiveFields();
}
