package atrium.core.model.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * Rollup of the requests to one endpoint in one hourly or daily bucket.
 *
 * <p>Percentiles are exact for hourly aggregates built from raw entries. Daily aggregates built
 * from hourly ones carry request-weighted means of the hourly percentiles.
 *
 * @param throughput requests per second over the bucket
 * @param topErrors  error code counts within the bucket
 */
public record AggregatedMetric(
        String endpoint,
        Instant windowStart,
        Granularity granularity,
        long totalRequests,
        long failedRequests,
        double averageResponseTime,
        long p50ResponseTime,
        long p95ResponseTime,
        long p99ResponseTime,
        double throughput,
        Map<String, Long> topErrors) {

    public AggregatedMetric {
        topErrors = topErrors != null ? Map.copyOf(topErrors) : Map.of();
    }

    public double errorRate() {
        return totalRequests == 0 ? 0.0 : (double) failedRequests / totalRequests;
    }
}
