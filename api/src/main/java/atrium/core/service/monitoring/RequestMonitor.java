package atrium.core.service.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import atrium.core.config.MonitoringConfig;
import atrium.core.model.monitoring.AggregatedMetric;
import atrium.core.model.monitoring.EndpointHealth;
import atrium.core.model.monitoring.Granularity;
import atrium.core.model.monitoring.HealthStatus;
import atrium.core.model.monitoring.HealthSummary;
import atrium.core.model.monitoring.RequestCompletion;
import atrium.core.model.monitoring.RequestHandle;
import atrium.core.model.monitoring.RequestLogEntry;
import atrium.core.port.out.Metrics;
import atrium.core.service.monitoring.AggregateMath.BucketKey;

/**
 * Times requests, keeps live per-endpoint counters, and rolls raw request logs up into hourly and
 * daily aggregates.
 *
 * <p>Three tiers of state, each bounded:
 * <ul>
 *   <li>Raw log: lock-free deque capped at {@code max-raw-entries}, drained into hourly aggregates
 *       once entries are older than {@code raw-retention}</li>
 *   <li>Hourly aggregates: folded into daily aggregates after {@code hourly-retention}</li>
 *   <li>Daily aggregates: dropped after {@code daily-retention}</li>
 * </ul>
 *
 * <p>The request path never takes the aggregate lock. It appends to the deque and bumps
 * {@link LongAdder} counters in the current live window. The rollup moves entries from the deque
 * to the aggregate maps under the write lock, and readers build reports under the read lock, so
 * a report sees each entry exactly once.
 */
@ApplicationScoped
public class RequestMonitor {

    private static final Logger LOG = Logger.getLogger(RequestMonitor.class);

    static final int MAX_USER_AGENT_LENGTH = 200;
    static final int MAX_ERROR_MESSAGE_LENGTH = 500;
    private static final int TOP_ENDPOINTS = 5;
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final MonitoringConfig config;
    private final Metrics metrics;
    private final LongSupplier clock;

    private final ConcurrentLinkedDeque<RequestLogEntry> rawLog = new ConcurrentLinkedDeque<>();
    private final AtomicInteger rawSize = new AtomicInteger();
    private final LongAdder droppedEntries = new LongAdder();
    private final AtomicReference<LiveWindow> liveWindow;

    private final ReadWriteLock aggregateLock = new ReentrantReadWriteLock();
    // Guarded by aggregateLock
    private final Map<BucketKey, AggregatedMetric> hourly = new HashMap<>();
    private final Map<BucketKey, AggregatedMetric> daily = new HashMap<>();

    @Inject
    public RequestMonitor(MonitoringConfig config, Metrics metrics) {
        this(config, metrics, System::currentTimeMillis);
    }

    public RequestMonitor(MonitoringConfig config, Metrics metrics, LongSupplier clock) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.liveWindow = new AtomicReference<>(new LiveWindow(clock.getAsLong(), config.reservoirSize()));
    }

    // -------------------------------------------------------------------------
    // Request lifecycle
    // -------------------------------------------------------------------------

    /**
     * Begin timing a request.
     *
     * @param endpoint logical endpoint name
     * @param method   HTTP method
     * @return the handle to pass to {@link #endRequest}
     */
    public RequestHandle startRequest(String endpoint, String method) {
        final var now = clock.getAsLong();
        return new RequestHandle(generateRequestId(now), endpoint, method, System.nanoTime(), now);
    }

    /**
     * Finish a request: compute its duration, append it to the raw log and update live counters.
     *
     * @param handle     the handle from {@link #startRequest}
     * @param completion outcome details
     * @return the recorded entry
     */
    public RequestLogEntry endRequest(RequestHandle handle, RequestCompletion completion) {
        final var durationMs = Math.max(0, (System.nanoTime() - handle.startNanos()) / 1_000_000);
        final var entry = new RequestLogEntry(
                handle.requestId(),
                handle.endpoint(),
                handle.method(),
                completion.status(),
                completion.ip(),
                truncate(completion.userAgent(), MAX_USER_AGENT_LENGTH),
                completion.requestSize(),
                completion.responseSize(),
                durationMs,
                completion.errorCode(),
                truncate(completion.errorMessage(), MAX_ERROR_MESSAGE_LENGTH),
                clock.getAsLong());
        record(entry);
        return entry;
    }

    /**
     * Append a completed entry. Package-private so tests can feed entries with fixed durations and
     * timestamps.
     */
    void record(RequestLogEntry entry) {
        rawLog.addLast(entry);
        if (rawSize.incrementAndGet() > config.maxRawEntries()) {
            trimRawLog();
        }

        currentWindow(clock.getAsLong()).record(entry);
        metrics.recordRequest(entry.endpoint(), entry.method(), entry.status(), entry.durationMs());

        if (entry.durationMs() > config.slowRequestThreshold().toMillis()) {
            LOG.warnv(
                    "Slow request {0}: {1} {2} took {3}ms (status {4})",
                    entry.requestId(), entry.method(), entry.endpoint(), entry.durationMs(), entry.status());
        }
    }

    private void trimRawLog() {
        while (rawSize.get() > config.maxRawEntries()) {
            if (rawLog.pollFirst() == null) {
                break;
            }
            rawSize.decrementAndGet();
            droppedEntries.increment();
        }
    }

    static String generateRequestId(long nowMs) {
        final var random = ThreadLocalRandom.current();
        final var suffix = new StringBuilder(9);
        for (var i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "req_" + nowMs + "_" + suffix;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    // -------------------------------------------------------------------------
    // Health
    // -------------------------------------------------------------------------

    /**
     * Summarize the current live window. Cost is proportional to the number of endpoints, not the
     * number of requests.
     */
    public HealthSummary getHealthSummary() {
        final var window = currentWindow(clock.getAsLong());
        final var endpoints = new ArrayList<EndpointHealth>();
        var total = 0L;
        var errors = 0L;
        var durationSum = 0L;
        final var samples = new ArrayList<long[]>();
        var sampleCount = 0;

        for (final var e : window.endpoints.entrySet()) {
            final var counters = e.getValue();
            final var snapshot = counters.reservoir.snapshot();
            final var endpointTotal = counters.total.sum();
            final var endpointFailed = counters.failed.sum();
            final var endpointDuration = counters.durationSum.sum();
            endpoints.add(new EndpointHealth(
                    e.getKey(),
                    endpointTotal,
                    endpointFailed,
                    endpointTotal == 0 ? 0.0 : (double) endpointDuration / endpointTotal,
                    Percentiles.percentile(Percentiles.sorted(snapshot), 0.95)));
            total += endpointTotal;
            errors += endpointFailed;
            durationSum += endpointDuration;
            samples.add(snapshot);
            sampleCount += snapshot.length;
        }

        final var merged = new long[sampleCount];
        var offset = 0;
        for (final var s : samples) {
            System.arraycopy(s, 0, merged, offset, s.length);
            offset += s.length;
        }
        final var p95 = Percentiles.percentile(Percentiles.sorted(merged), 0.95);
        final var errorRate = total == 0 ? 0.0 : (double) errors / total;

        return new HealthSummary(
                classify(errorRate, p95),
                Instant.ofEpochMilli(window.startMs),
                total,
                errors,
                errorRate,
                total == 0 ? 0.0 : (double) durationSum / total,
                p95,
                endpoints.stream()
                        .filter(h -> h.failedRequests() > 0)
                        .sorted(Comparator.comparingLong(EndpointHealth::failedRequests).reversed())
                        .limit(TOP_ENDPOINTS)
                        .toList(),
                endpoints.stream()
                        .sorted(Comparator.comparingDouble(EndpointHealth::averageResponseTime).reversed())
                        .limit(TOP_ENDPOINTS)
                        .toList(),
                droppedEntries.sum());
    }

    /**
     * Healthy below both thresholds, degraded while neither doubled threshold is reached,
     * unhealthy otherwise.
     */
    HealthStatus classify(double errorRate, long p95Ms) {
        final var errorThreshold = config.errorRateThreshold();
        final var latencyThreshold = config.latencyThreshold().toMillis();
        if (errorRate < errorThreshold && p95Ms < latencyThreshold) {
            return HealthStatus.HEALTHY;
        }
        if (errorRate < errorThreshold * 2 && p95Ms < latencyThreshold * 2) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.UNHEALTHY;
    }

    private LiveWindow currentWindow(long nowMs) {
        final var current = liveWindow.get();
        if (nowMs - current.startMs < config.healthWindow().toMillis()) {
            return current;
        }
        // Losing the race means another thread already rotated
        liveWindow.compareAndSet(current, new LiveWindow(nowMs, config.reservoirSize()));
        return liveWindow.get();
    }

    // -------------------------------------------------------------------------
    // Rollup
    // -------------------------------------------------------------------------

    /**
     * Counts of what one rollup pass moved.
     */
    public record RollupResult(int foldedEntries, int foldedHours, int evictedDays) {}

    @Scheduled(
            every = "${atrium.monitoring.rollup-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledRollup() {
        final var result = rollup(clock.getAsLong());
        if (result.foldedEntries() > 0 || result.foldedHours() > 0 || result.evictedDays() > 0) {
            LOG.debugv(
                    "Rollup folded {0} raw entries, {1} hourly aggregates, evicted {2} daily aggregates",
                    result.foldedEntries(), result.foldedHours(), result.evictedDays());
        }
    }

    /**
     * Fold and evict according to the retention horizons.
     *
     * @param nowMs current time in epoch milliseconds
     * @return what was moved
     */
    public RollupResult rollup(long nowMs) {
        final var rawCutoff = Granularity.HOURLY.truncate(nowMs - config.rawRetention().toMillis());
        final var hourlyCutoff = Granularity.DAILY.truncate(nowMs - config.hourlyRetention().toMillis());
        final var dailyCutoff = nowMs - config.dailyRetention().toMillis();

        aggregateLock.writeLock().lock();
        try {
            final var drained = new ArrayList<RequestLogEntry>();
            RequestLogEntry head;
            while ((head = rawLog.peekFirst()) != null && head.timestampMs() < rawCutoff) {
                final var polled = rawLog.pollFirst();
                if (polled == null) {
                    break;
                }
                rawSize.decrementAndGet();
                drained.add(polled);
            }
            aggregate(drained, Granularity.HOURLY).values().forEach(m -> AggregateMath.fold(hourly, m, Granularity.HOURLY));

            var foldedHours = 0;
            final var hourlyIterator = hourly.entrySet().iterator();
            while (hourlyIterator.hasNext()) {
                final var metric = hourlyIterator.next().getValue();
                if (metric.windowStart().toEpochMilli() < hourlyCutoff) {
                    AggregateMath.fold(daily, metric, Granularity.DAILY);
                    hourlyIterator.remove();
                    foldedHours++;
                }
            }

            final var sizeBefore = daily.size();
            daily.values().removeIf(m -> m.windowStart().toEpochMilli() < dailyCutoff);

            return new RollupResult(drained.size(), foldedHours, sizeBefore - daily.size());
        } finally {
            aggregateLock.writeLock().unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Reports
    // -------------------------------------------------------------------------

    /**
     * Hourly aggregates: stored ones plus the raw entries not yet rolled up.
     *
     * @return aggregates ordered by window start, then endpoint
     */
    public List<AggregatedMetric> getHourlyPerformance() {
        aggregateLock.readLock().lock();
        try {
            final var result = new HashMap<>(hourly);
            aggregate(List.copyOf(rawLog), Granularity.HOURLY)
                    .values()
                    .forEach(m -> AggregateMath.fold(result, m, Granularity.HOURLY));
            return sorted(result);
        } finally {
            aggregateLock.readLock().unlock();
        }
    }

    /**
     * Daily aggregates: stored ones plus hourly aggregates and raw entries not yet folded.
     *
     * @return aggregates ordered by window start, then endpoint
     */
    public List<AggregatedMetric> getDailyAnalytics() {
        aggregateLock.readLock().lock();
        try {
            final var result = new HashMap<>(daily);
            hourly.values().forEach(m -> AggregateMath.fold(result, m, Granularity.DAILY));
            aggregate(List.copyOf(rawLog), Granularity.DAILY)
                    .values()
                    .forEach(m -> AggregateMath.fold(result, m, Granularity.DAILY));
            return sorted(result);
        } finally {
            aggregateLock.readLock().unlock();
        }
    }

    /**
     * @return number of raw entries currently held
     */
    public int rawLogSize() {
        return rawSize.get();
    }

    public long droppedEntries() {
        return droppedEntries.sum();
    }

    private static Map<BucketKey, AggregatedMetric> aggregate(List<RequestLogEntry> entries, Granularity granularity) {
        final var grouped = entries.stream()
                .collect(Collectors.groupingBy(
                        e -> new BucketKey(e.endpoint(), granularity.truncate(e.timestampMs()))));
        final var result = new HashMap<BucketKey, AggregatedMetric>();
        grouped.forEach((key, group) -> result.put(
                key, AggregateMath.fromEntries(key.endpoint(), key.windowStartMs(), granularity, group)));
        return result;
    }

    private static List<AggregatedMetric> sorted(Map<BucketKey, AggregatedMetric> metrics) {
        return metrics.values().stream()
                .sorted(Comparator.comparing(AggregatedMetric::windowStart).thenComparing(AggregatedMetric::endpoint))
                .toList();
    }

    // -------------------------------------------------------------------------
    // Live window
    // -------------------------------------------------------------------------

    private static final class LiveWindow {

        private final long startMs;
        private final int reservoirSize;
        private final ConcurrentHashMap<String, EndpointCounters> endpoints = new ConcurrentHashMap<>();

        LiveWindow(long startMs, int reservoirSize) {
            this.startMs = startMs;
            this.reservoirSize = reservoirSize;
        }

        void record(RequestLogEntry entry) {
            endpoints.computeIfAbsent(entry.endpoint(), k -> new EndpointCounters(reservoirSize)).record(entry);
        }
    }

    private static final class EndpointCounters {

        private final LongAdder total = new LongAdder();
        private final LongAdder failed = new LongAdder();
        private final LongAdder durationSum = new LongAdder();
        private final LatencyReservoir reservoir;

        EndpointCounters(int reservoirSize) {
            this.reservoir = new LatencyReservoir(reservoirSize);
        }

        void record(RequestLogEntry entry) {
            total.increment();
            if (!entry.isSuccess()) {
                failed.increment();
            }
            durationSum.add(entry.durationMs());
            reservoir.add(entry.durationMs());
        }
    }

    /**
     * Ring buffer of the most recent latencies for one endpoint. Locked per endpoint.
     */
    private static final class LatencyReservoir {

        private final long[] samples;
        private int next;
        private int count;

        LatencyReservoir(int size) {
            this.samples = new long[Math.max(1, size)];
        }

        synchronized void add(long value) {
            samples[next] = value;
            next = (next + 1) % samples.length;
            count = Math.min(count + 1, samples.length);
        }

        synchronized long[] snapshot() {
            final var copy = new long[count];
            System.arraycopy(samples, 0, copy, 0, count);
            return copy;
        }
    }
}
