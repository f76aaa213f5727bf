package atrium.core.service.monitoring;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import atrium.core.config.PipelineConfig;
import atrium.core.model.common.ApiErrors;
import atrium.core.model.monitoring.HealthStatus;
import atrium.core.model.pipeline.AgentCall;
import atrium.core.model.pipeline.HandlerResult;

/**
 * Handlers for the health and performance endpoints, backed by the {@link RequestMonitor}.
 *
 * <p>The public health check answers 503 when the service is unhealthy. Performance reports
 * require an authenticated caller.
 */
@ApplicationScoped
public class HealthReportService {

    private final RequestMonitor monitor;
    private final PipelineConfig config;
    private final Clock clock;
    private final Instant startedAt;

    @Inject
    public HealthReportService(RequestMonitor monitor, PipelineConfig config) {
        this(monitor, config, Clock.systemUTC());
    }

    public HealthReportService(RequestMonitor monitor, PipelineConfig config, Clock clock) {
        this.monitor = monitor;
        this.config = config;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public Uni<HandlerResult> health(AgentCall call) {
        final var summary = monitor.getHealthSummary();
        final var now = clock.instant();

        final var body = new LinkedHashMap<String, Object>();
        body.put("status", summary.status());
        body.put("timestamp", now.toString());
        body.put("version", config.apiVersion());
        body.put("uptime", Duration.between(startedAt, now).toSeconds());
        body.put("summary", summary);

        final var status = summary.status() == HealthStatus.UNHEALTHY ? 503 : 200;
        return Uni.createFrom().item(new HandlerResult.Payload(status, body));
    }

    public Uni<HandlerResult> performance(AgentCall call) {
        return authenticated(call, () -> Map.of(
                "summary", monitor.getHealthSummary(),
                "rawLogSize", monitor.rawLogSize(),
                "droppedEntries", monitor.droppedEntries(),
                "timestamp", clock.instant().toString()));
    }

    public Uni<HandlerResult> hourly(AgentCall call) {
        return authenticated(call, () -> Map.of("hourly", monitor.getHourlyPerformance()));
    }

    public Uni<HandlerResult> daily(AgentCall call) {
        return authenticated(call, () -> Map.of("daily", monitor.getDailyAnalytics()));
    }

    private static Uni<HandlerResult> authenticated(AgentCall call, Supplier<Object> body) {
        if (call.viewerId() == null) {
            return Uni.createFrom().item(HandlerResult.rejected(ApiErrors.unauthenticated()));
        }
        return Uni.createFrom().item(() -> HandlerResult.ok(body.get()));
    }
}
