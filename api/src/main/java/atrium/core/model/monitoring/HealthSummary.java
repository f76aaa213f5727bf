package atrium.core.model.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * Health snapshot derived from the live counters of the current window.
 */
public record HealthSummary(
        HealthStatus status,
        Instant windowStart,
        long totalRequests,
        long totalErrors,
        double overallErrorRate,
        double averageResponseTime,
        long p95ResponseTime,
        List<EndpointHealth> topErrorEndpoints,
        List<EndpointHealth> topSlowEndpoints,
        long droppedLogEntries) {

    public HealthSummary {
        topErrorEndpoints = topErrorEndpoints != null ? List.copyOf(topErrorEndpoints) : List.of();
        topSlowEndpoints = topSlowEndpoints != null ? List.copyOf(topSlowEndpoints) : List.of();
    }
}
