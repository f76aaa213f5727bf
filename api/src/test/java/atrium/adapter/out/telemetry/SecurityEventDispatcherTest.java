package atrium.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import atrium.core.port.out.Metrics;
import atrium.spi.SecurityEvent;
import atrium.spi.SecurityEventHandler;
import atrium.support.TestConfigs.TestMonitoringConfig;

@DisplayName("SecurityEventDispatcher")
class SecurityEventDispatcherTest {

    private SimpleMeterRegistry registry;
    private SecurityEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        dispatcher = new SecurityEventDispatcher(TestMonitoringConfig.defaults(), registry, mock(Metrics.class));
        dispatcher.init();
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    @DisplayName("should load the built-in handlers in priority order")
    void loadsHandlers() {
        var names = dispatcher.getHandlers().stream().map(SecurityEventHandler::name).toList();

        assertEquals(List.of("metrics", "logging"), names);
        assertTrue(dispatcher.isEnabled());
    }

    @Test
    @DisplayName("should deliver events to the metrics handler off the calling thread")
    void deliversEvents() throws InterruptedException {
        dispatcher.publish(new SecurityEvent.RateLimitExceeded(
                Instant.now(), "abcd1234", "request_meeting", "request-meeting", 6, 5, 60));

        var deadline = System.currentTimeMillis() + 2_000;
        while (!delivered() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        var counter = registry.find("atrium.security.rate_limit.exceeded")
                .tag("tier", "request-meeting")
                .counter();
        assertEquals(1.0, counter.count());
    }

    private boolean delivered() {
        var counter = registry.find("atrium.security.rate_limit.exceeded").counter();
        return counter != null && counter.count() >= 1.0;
    }

    @Test
    @DisplayName("should drop and count events once the queue is full")
    void dropsEventsWhenQueueIsFull() throws InterruptedException {
        var metrics = mock(Metrics.class);
        var bounded = new SecurityEventDispatcher(
                TestMonitoringConfig.defaults().withSecurityEventQueueCapacity(1), registry, metrics);
        var slowHandler = new BlockingHandler();
        bounded.start(List.of(slowHandler));
        try {
            bounded.publish(blocked());
            assertTrue(slowHandler.started.await(2, TimeUnit.SECONDS));

            bounded.publish(blocked());
            bounded.publish(blocked());
            bounded.publish(blocked());

            verify(metrics, times(2)).recordSecurityEventDropped("RequestBlocked");

            slowHandler.release.countDown();
            var deadline = System.currentTimeMillis() + 2_000;
            while (slowHandler.handled.get() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(2, slowHandler.handled.get());
        } finally {
            slowHandler.release.countDown();
            bounded.shutdown();
        }
    }

    @Test
    @DisplayName("should ignore events when disabled")
    void disabled() {
        var metrics = mock(Metrics.class);
        var config = new TestMonitoringConfig(
                true,
                false,
                1,
                10_000,
                TestMonitoringConfig.defaults().rawRetention(),
                TestMonitoringConfig.defaults().hourlyRetention(),
                TestMonitoringConfig.defaults().dailyRetention(),
                TestMonitoringConfig.defaults().rollupInterval(),
                TestMonitoringConfig.defaults().healthWindow(),
                512,
                0.10,
                TestMonitoringConfig.defaults().latencyThreshold(),
                TestMonitoringConfig.defaults().slowRequestThreshold(),
                TestMonitoringConfig.defaults().sensitiveFields());
        var off = new SecurityEventDispatcher(config, registry, metrics);
        off.init();

        off.publish(blocked());

        assertTrue(off.getHandlers().isEmpty());
        verify(metrics, never()).recordSecurityEventDropped("RequestBlocked");
    }

    private static SecurityEvent blocked() {
        return new SecurityEvent.RequestBlocked(
                Instant.now(), "abcd1234", "search_profiles", "POST", "curl/8.0", List.of("Request body too large"));
    }

    private static final class BlockingHandler implements SecurityEventHandler {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger handled = new AtomicInteger();

        @Override
        public String name() {
            return "blocking";
        }

        @Override
        public void handle(SecurityEvent event) {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handled.incrementAndGet();
        }
    }
}
