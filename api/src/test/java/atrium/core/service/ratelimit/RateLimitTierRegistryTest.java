package atrium.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import atrium.core.model.ratelimit.RateLimitTier;
import atrium.core.port.out.RateLimiter;

@DisplayName("Rate limit tiers and sweeps")
class RateLimitTierRegistryTest {

    @Test
    @DisplayName("should resolve configured tiers by name")
    void resolvesConfigured() {
        var registry = new RateLimitTierRegistry(Map.of(
                "search", RateLimitTier.of("search", 30, Duration.ofSeconds(60)),
                "default", RateLimitTier.of("default", 100, Duration.ofSeconds(60))));

        assertEquals(30, registry.resolve("search").maxRequests());
    }

    @Test
    @DisplayName("should fall back to the configured default tier")
    void fallsBackToDefault() {
        var registry = new RateLimitTierRegistry(
                Map.of("default", RateLimitTier.of("default", 42, Duration.ofSeconds(10))));

        var tier = registry.resolve("unknown");

        assertEquals(42, tier.maxRequests());
        assertEquals(10_000, tier.windowMs());
    }

    @Test
    @DisplayName("should fall back to 100 per minute when nothing is configured")
    void builtInDefault() {
        var tier = new RateLimitTierRegistry(Map.of()).resolve("search");

        assertEquals(100, tier.maxRequests());
        assertEquals(60_000, tier.windowMs());
    }

    @Test
    @DisplayName("sweep should skip a disabled limiter")
    void sweepSkipsDisabled() {
        var limiter = mock(RateLimiter.class);
        when(limiter.isEnabled()).thenReturn(false);

        new RateLimitSweepService(limiter).sweep();

        verify(limiter, never()).sweepIdleBuckets(anyLong());
    }

    @Test
    @DisplayName("sweep should evict idle buckets of an enabled limiter")
    void sweepRuns() {
        var limiter = mock(RateLimiter.class);
        when(limiter.isEnabled()).thenReturn(true);
        when(limiter.sweepIdleBuckets(anyLong())).thenReturn(3);

        new RateLimitSweepService(limiter).sweep();

        verify(limiter).sweepIdleBuckets(anyLong());
    }
}
