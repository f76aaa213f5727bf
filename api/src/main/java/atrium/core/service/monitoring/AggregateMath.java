package atrium.core.service.monitoring;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import atrium.core.model.monitoring.AggregatedMetric;
import atrium.core.model.monitoring.Granularity;
import atrium.core.model.monitoring.RequestLogEntry;

/**
 * Builds and merges aggregates.
 */
final class AggregateMath {

    private AggregateMath() {}

    /**
     * Exact aggregate of raw entries that all belong to one endpoint and bucket.
     */
    static AggregatedMetric fromEntries(
            String endpoint, long windowStartMs, Granularity granularity, List<RequestLogEntry> entries) {
        final var durations = new long[entries.size()];
        var failed = 0L;
        var totalDuration = 0L;
        final var errors = new HashMap<String, Long>();
        for (var i = 0; i < entries.size(); i++) {
            final var entry = entries.get(i);
            durations[i] = entry.durationMs();
            totalDuration += entry.durationMs();
            if (!entry.isSuccess()) {
                failed++;
                errors.merge(entry.errorCode() != null ? entry.errorCode() : "HTTP_" + entry.status(), 1L, Long::sum);
            }
        }
        final var sorted = Percentiles.sorted(durations);
        final var total = entries.size();
        return new AggregatedMetric(
                endpoint,
                Instant.ofEpochMilli(windowStartMs),
                granularity,
                total,
                failed,
                total == 0 ? 0.0 : (double) totalDuration / total,
                Percentiles.percentile(sorted, 0.50),
                Percentiles.percentile(sorted, 0.95),
                Percentiles.percentile(sorted, 0.99),
                throughput(total, granularity),
                errors);
    }

    /**
     * Merge two aggregates of the same endpoint into a bucket of the given granularity.
     *
     * <p>Percentiles of the result are request-weighted means of the inputs, an approximation that
     * keeps p50 &lt;= p95 &lt;= p99 because each input already satisfies it.
     */
    static AggregatedMetric merge(AggregatedMetric a, AggregatedMetric b, long windowStartMs, Granularity granularity) {
        final var total = a.totalRequests() + b.totalRequests();
        final var errors = new HashMap<>(a.topErrors());
        b.topErrors().forEach((code, count) -> errors.merge(code, count, Long::sum));
        return new AggregatedMetric(
                a.endpoint(),
                Instant.ofEpochMilli(windowStartMs),
                granularity,
                total,
                a.failedRequests() + b.failedRequests(),
                weighted(a.averageResponseTime(), a.totalRequests(), b.averageResponseTime(), b.totalRequests()),
                Math.round(weighted(a.p50ResponseTime(), a.totalRequests(), b.p50ResponseTime(), b.totalRequests())),
                Math.round(weighted(a.p95ResponseTime(), a.totalRequests(), b.p95ResponseTime(), b.totalRequests())),
                Math.round(weighted(a.p99ResponseTime(), a.totalRequests(), b.p99ResponseTime(), b.totalRequests())),
                throughput(total, granularity),
                errors);
    }

    /**
     * Re-bucket an aggregate into a coarser granularity without merging.
     */
    static AggregatedMetric rebucket(AggregatedMetric metric, long windowStartMs, Granularity granularity) {
        return new AggregatedMetric(
                metric.endpoint(),
                Instant.ofEpochMilli(windowStartMs),
                granularity,
                metric.totalRequests(),
                metric.failedRequests(),
                metric.averageResponseTime(),
                metric.p50ResponseTime(),
                metric.p95ResponseTime(),
                metric.p99ResponseTime(),
                throughput(metric.totalRequests(), granularity),
                metric.topErrors());
    }

    /**
     * Fold a metric into a map keyed by endpoint and bucket start.
     */
    static void fold(Map<BucketKey, AggregatedMetric> target, AggregatedMetric metric, Granularity granularity) {
        final var start = granularity.truncate(metric.windowStart().toEpochMilli());
        final var key = new BucketKey(metric.endpoint(), start);
        target.merge(
                key,
                rebucket(metric, start, granularity),
                (existing, incoming) -> merge(existing, incoming, start, granularity));
    }

    private static double weighted(double a, long weightA, double b, long weightB) {
        final var total = weightA + weightB;
        return total == 0 ? 0.0 : (a * weightA + b * weightB) / total;
    }

    private static double throughput(long total, Granularity granularity) {
        return total / (granularity.lengthMs() / 1000.0);
    }

    /**
     * Key of an aggregate bucket.
     */
    record BucketKey(String endpoint, long windowStartMs) {}
}
