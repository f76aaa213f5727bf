package atrium.core.service.monitoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import atrium.core.model.monitoring.AggregatedMetric;
import atrium.core.model.monitoring.HealthStatus;
import atrium.core.model.monitoring.RequestCompletion;
import atrium.core.model.monitoring.RequestLogEntry;
import atrium.core.port.out.Metrics;
import atrium.support.TestConfigs.TestMonitoringConfig;

@DisplayName("RequestMonitor")
class RequestMonitorTest {

    private static final long NOW = Instant.parse("2024-06-01T12:30:00Z").toEpochMilli();

    private AtomicLong clock;
    private Metrics metrics;
    private RequestMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(NOW);
        metrics = mock(Metrics.class);
        monitor = new RequestMonitor(TestMonitoringConfig.defaults(), metrics, clock::get);
    }

    private static RequestLogEntry entry(String endpoint, int status, long durationMs, long timestampMs) {
        return new RequestLogEntry(
                "req_" + timestampMs + "_abcdefghi",
                endpoint,
                "GET",
                status,
                "1.2.3.4",
                "test-agent",
                0,
                10,
                durationMs,
                status >= 400 ? "E" + status : null,
                null,
                timestampMs);
    }

    private static long total(List<AggregatedMetric> metrics) {
        return metrics.stream().mapToLong(AggregatedMetric::totalRequests).sum();
    }

    @Nested
    @DisplayName("Request lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should record a timed entry and report it to metrics")
        void startAndEnd() {
            var handle = monitor.startRequest("search_profiles", "GET");

            var entry = monitor.endRequest(
                    handle, RequestCompletion.success(200, "1.2.3.4", "agent", 0, 42));

            assertTrue(handle.requestId().matches("req_\\d+_[a-z0-9]{9}"), handle.requestId());
            assertEquals("search_profiles", entry.endpoint());
            assertEquals(NOW, entry.timestampMs());
            assertEquals(1, monitor.rawLogSize());
            verify(metrics).recordRequest(eq("search_profiles"), eq("GET"), eq(200), anyLong());
        }

        @Test
        @DisplayName("should truncate long user agents and error messages")
        void truncates() {
            var handle = monitor.startRequest("get_profile", "GET");

            var entry = monitor.endRequest(
                    handle,
                    new RequestCompletion(500, "1.2.3.4", "u".repeat(300), 0, 0, "INTERNAL_ERROR", "m".repeat(600)));

            assertEquals(RequestMonitor.MAX_USER_AGENT_LENGTH, entry.userAgent().length());
            assertEquals(RequestMonitor.MAX_ERROR_MESSAGE_LENGTH, entry.errorMessage().length());
        }

        @Test
        @DisplayName("should drop the oldest entries beyond the raw cap and count them")
        void rawCap() {
            var capped = new RequestMonitor(TestMonitoringConfig.defaults().withMaxRawEntries(5), metrics, clock::get);

            for (var i = 0; i < 8; i++) {
                capped.record(entry("search_profiles", 200, 10, NOW + i));
            }

            assertEquals(5, capped.rawLogSize());
            assertEquals(3, capped.droppedEntries());
            assertEquals(3, capped.getHealthSummary().droppedLogEntries());
        }
    }

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("should be healthy with no traffic")
        void noTraffic() {
            var summary = monitor.getHealthSummary();

            assertEquals(HealthStatus.HEALTHY, summary.status());
            assertEquals(0, summary.totalRequests());
        }

        @Test
        @DisplayName("should classify by error rate against the threshold and its double")
        void errorRateBands() {
            assertEquals(HealthStatus.HEALTHY, monitor.classify(0.05, 100));
            assertEquals(HealthStatus.DEGRADED, monitor.classify(0.15, 100));
            assertEquals(HealthStatus.UNHEALTHY, monitor.classify(0.25, 100));
        }

        @Test
        @DisplayName("should classify by p95 latency against the threshold and its double")
        void latencyBands() {
            assertEquals(HealthStatus.HEALTHY, monitor.classify(0.0, 4_999));
            assertEquals(HealthStatus.DEGRADED, monitor.classify(0.0, 5_000));
            assertEquals(HealthStatus.UNHEALTHY, monitor.classify(0.0, 10_000));
        }

        @Test
        @DisplayName("should summarize the live window and rank failing endpoints")
        void summary() {
            for (var i = 0; i < 8; i++) {
                monitor.record(entry("search_profiles", 200, 20, NOW));
            }
            monitor.record(entry("request_meeting", 500, 40, NOW));
            monitor.record(entry("request_meeting", 429, 40, NOW));

            var summary = monitor.getHealthSummary();

            assertEquals(10, summary.totalRequests());
            assertEquals(2, summary.totalErrors());
            assertEquals(0.2, summary.overallErrorRate(), 1e-9);
            assertEquals(HealthStatus.UNHEALTHY, summary.status());
            assertEquals("request_meeting", summary.topErrorEndpoints().get(0).endpoint());
            assertEquals("request_meeting", summary.topSlowEndpoints().get(0).endpoint());
        }

        @Test
        @DisplayName("should start a fresh window once the health window has elapsed")
        void windowRotation() {
            monitor.record(entry("search_profiles", 500, 20, NOW));

            clock.addAndGet(Duration.ofMinutes(61).toMillis());

            assertEquals(0, monitor.getHealthSummary().totalRequests());
        }
    }

    @Nested
    @DisplayName("Rollup")
    class RollupTests {

        @Test
        @DisplayName("should count each entry exactly once before and after a rollup")
        void noDoubleCounting() {
            var threeHoursAgo = NOW - Duration.ofHours(3).toMillis();
            for (var i = 0; i < 3; i++) {
                monitor.record(entry("search_profiles", 200, 10 + i, threeHoursAgo));
            }
            monitor.record(entry("search_profiles", 200, 10, NOW));
            monitor.record(entry("get_profile", 404, 10, NOW));

            assertEquals(5, total(monitor.getHourlyPerformance()));
            assertEquals(5, total(monitor.getDailyAnalytics()));

            var result = monitor.rollup(NOW);

            assertEquals(3, result.foldedEntries());
            assertEquals(2, monitor.rawLogSize());
            assertEquals(5, total(monitor.getHourlyPerformance()));
            assertEquals(5, total(monitor.getDailyAnalytics()));
        }

        @Test
        @DisplayName("should bucket hourly aggregates by endpoint and hour")
        void hourlyBuckets() {
            monitor.record(entry("search_profiles", 200, 10, NOW));
            monitor.record(entry("search_profiles", 500, 30, NOW));
            monitor.record(entry("get_profile", 200, 10, NOW));

            var hourly = monitor.getHourlyPerformance();

            assertEquals(2, hourly.size());
            var search = hourly.stream()
                    .filter(m -> m.endpoint().equals("search_profiles"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(Instant.parse("2024-06-01T12:00:00Z"), search.windowStart());
            assertEquals(2, search.totalRequests());
            assertEquals(1, search.failedRequests());
            assertEquals(20.0, search.averageResponseTime(), 1e-9);
            assertEquals(1L, search.topErrors().get("E500"));
        }

        @Test
        @DisplayName("should fold old hours into days and evict expired days")
        void foldAndEvict() {
            var threeDaysAgo = NOW - Duration.ofDays(3).toMillis();
            var tenDaysAgo = NOW - Duration.ofDays(10).toMillis();
            monitor.record(entry("search_profiles", 200, 10, tenDaysAgo));
            monitor.record(entry("search_profiles", 200, 10, threeDaysAgo));

            var result = monitor.rollup(NOW);

            assertEquals(2, result.foldedEntries());
            assertEquals(2, result.foldedHours());
            assertEquals(1, result.evictedDays());
            assertTrue(monitor.getHourlyPerformance().isEmpty());
            var daily = monitor.getDailyAnalytics();
            assertEquals(1, daily.size());
            assertEquals(1, daily.get(0).totalRequests());
        }
    }
}
