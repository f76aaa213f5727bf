package atrium.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import atrium.core.model.ratelimit.RateLimitKey;
import atrium.core.model.ratelimit.RateLimitTier;

@DisplayName("InMemoryRateLimiter")
class InMemoryRateLimiterTest {

    private static final long START = 1_700_000_000_000L;

    private AtomicLong now;
    private InMemoryRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(START);
        rateLimiter = new InMemoryRateLimiter(true, 4, now::get);
    }

    private boolean check(String client, RateLimitTier tier) {
        return rateLimiter.checkLimit(client, tier).await().atMost(Duration.ofSeconds(1)).allowed();
    }

    @Nested
    @DisplayName("Window bound")
    class WindowBoundTests {

        @Test
        @DisplayName("should admit maxRequests and reject the next one in the same window")
        void shouldAdmitUpToLimit() {
            var tier = new RateLimitTier("test", 5, 60_000);

            for (int i = 0; i < 5; i++) {
                var decision = rateLimiter.checkLimit("ip:1.2.3.4", tier).await().atMost(Duration.ofSeconds(1));
                assertTrue(decision.allowed(), "Request " + (i + 1) + " should be allowed");
                assertEquals(4 - i, decision.remaining());
            }

            var rejected = rateLimiter.checkLimit("ip:1.2.3.4", tier).await().atMost(Duration.ofSeconds(1));

            assertFalse(rejected.allowed());
            assertEquals(0, rejected.remaining());
            assertEquals(6, rejected.totalHitsInWindow());
            assertTrue(rejected.retryAfterSeconds(now.get()) > 0);
        }

        @Test
        @DisplayName("should open a fresh window once windowMs has elapsed")
        void shouldResetAfterWindow() {
            var tier = new RateLimitTier("test", 2, 60_000);
            check("client", tier);
            check("client", tier);
            assertFalse(check("client", tier));

            now.addAndGet(60_000);
            var decision = rateLimiter.checkLimit("client", tier).await().atMost(Duration.ofSeconds(1));

            assertTrue(decision.allowed());
            assertEquals(1, decision.totalHitsInWindow());
            assertEquals(START + 120_000, decision.resetTimeEpochMs());
        }

        @Test
        @DisplayName("should still reject one millisecond before the window ends")
        void shouldRejectJustBeforeBoundary() {
            var tier = new RateLimitTier("test", 1, 60_000);
            check("client", tier);

            now.addAndGet(59_999);

            assertFalse(check("client", tier));
        }

        @Test
        @DisplayName("should track clients and tiers independently")
        void shouldTrackKeysIndependently() {
            var search = new RateLimitTier("search", 1, 60_000);
            var mutate = new RateLimitTier("mutate", 1, 60_000);

            assertTrue(check("client-a", search));
            assertFalse(check("client-a", search));
            assertTrue(check("client-b", search));
            assertTrue(check("client-a", mutate));
        }

        @Test
        @DisplayName("should admit everything when disabled")
        void shouldAdmitWhenDisabled() {
            var disabled = new InMemoryRateLimiter(false, 4, now::get);
            var tier = new RateLimitTier("test", 1, 60_000);

            for (int i = 0; i < 10; i++) {
                var decision = disabled.checkLimit("client", tier).await().atMost(Duration.ofSeconds(1));
                assertTrue(decision.allowed());
                assertTrue(decision.isUnlimited());
            }
            assertEquals(0, disabled.bucketCount());
        }

        @Test
        @DisplayName("should forget a key on reset")
        void shouldResetKey() {
            var tier = new RateLimitTier("test", 1, 60_000);
            check("client", tier);
            assertFalse(check("client", tier));

            rateLimiter.reset(new RateLimitKey("client", "test")).await().atMost(Duration.ofSeconds(1));

            assertTrue(check("client", tier));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit exactly maxRequests under concurrent access to one key")
        void shouldNeverOvershootUnderContention() throws Exception {
            var tier = new RateLimitTier("test", 50, 60_000);
            var threads = 16;
            var requestsPerThread = 25;
            var executor = Executors.newFixedThreadPool(threads);
            var startGate = new CountDownLatch(1);
            var admitted = new AtomicInteger();
            var rejected = new AtomicInteger();

            try {
                var tasks = new ArrayList<Callable<Void>>();
                for (int t = 0; t < threads; t++) {
                    tasks.add(() -> {
                        startGate.await();
                        for (int i = 0; i < requestsPerThread; i++) {
                            if (check("shared", tier)) {
                                admitted.incrementAndGet();
                            } else {
                                rejected.incrementAndGet();
                            }
                        }
                        return null;
                    });
                }
                var futures = tasks.stream().map(executor::submit).toList();
                startGate.countDown();
                for (var future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(50, admitted.get());
            assertEquals(threads * requestsPerThread - 50, rejected.get());
        }
    }

    @Nested
    @DisplayName("Idle sweep")
    class SweepTests {

        @Test
        @DisplayName("should remove buckets idle longer than windowMs times the multiplier")
        void shouldSweepIdleBuckets() {
            var tier = new RateLimitTier("test", 10, 1_000);
            check("idle", tier);
            now.addAndGet(3_000);
            check("active", tier);

            now.addAndGet(1_500);
            var removed = rateLimiter.sweepIdleBuckets(now.get());

            assertEquals(1, removed);
            assertEquals(1, rateLimiter.bucketCount());
        }

        @Test
        @DisplayName("should keep buckets that are still within the idle horizon")
        void shouldKeepRecentBuckets() {
            var tier = new RateLimitTier("test", 10, 1_000);
            check("client", tier);

            now.addAndGet(4_000);

            assertEquals(0, rateLimiter.sweepIdleBuckets(now.get()));
            assertEquals(1, rateLimiter.bucketCount());
        }

        @Test
        @DisplayName("should start a fresh bucket when a swept client returns")
        void shouldRecreateSweptBucket() {
            var tier = new RateLimitTier("test", 1, 1_000);
            check("client", tier);
            assertFalse(check("client", tier));

            now.addAndGet(10_000);
            rateLimiter.sweepIdleBuckets(now.get());

            assertTrue(check("client", tier));
        }
    }
}
