package atrium.adapter.out.ratelimit.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

import io.smallrye.mutiny.Uni;

import atrium.core.model.ratelimit.RateLimitDecision;
import atrium.core.model.ratelimit.RateLimitKey;
import atrium.core.model.ratelimit.RateLimitTier;
import atrium.core.model.ratelimit.WindowCounter;
import atrium.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>
 * Stores one {@link WindowCounter} per bucket in a concurrent hash map. Every hit runs inside
 * {@link ConcurrentMap#compute}, which serializes updates per key without a global lock, so no
 * increment is lost under concurrent access.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 *
 * <p>
 * For multi-instance deployments, use Redis-based rate limiting.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, WindowCounter> buckets;
    private final boolean enabled;
    private final int idleMultiplier;
    private final LongSupplier clock;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param enabled        whether rate limiting is enabled
     * @param idleMultiplier buckets idle for {@code windowMs * idleMultiplier} are swept
     * @param clock          source of epoch milliseconds
     */
    public InMemoryRateLimiter(boolean enabled, int idleMultiplier, LongSupplier clock) {
        this.buckets = new ConcurrentHashMap<>();
        this.enabled = enabled;
        this.idleMultiplier = idleMultiplier;
        this.clock = clock;
    }

    public InMemoryRateLimiter(boolean enabled, int idleMultiplier) {
        this(enabled, idleMultiplier, System::currentTimeMillis);
    }

    @Override
    public Uni<RateLimitDecision> checkLimit(String clientKey, RateLimitTier tier) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited());
        }
        return Uni.createFrom().item(decide(new RateLimitKey(clientKey, tier.name()), tier, clock.getAsLong()));
    }

    /**
     * Synchronous form of {@link #checkLimit}, used by tests and the reactive wrapper.
     */
    RateLimitDecision decide(RateLimitKey key, RateLimitTier tier, long nowMs) {
        final var updated = buckets.compute(
                key.toCacheKey(),
                (k, current) -> current == null ? WindowCounter.open(nowMs, tier.windowMs()) : current.hit(nowMs));
        return RateLimitDecision.fromCount(updated.count(), tier.maxRequests(), updated.resetAtMs());
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        buckets.remove(key.toCacheKey());
        return Uni.createFrom().voidItem();
    }

    /**
     * Remove idle buckets.
     *
     * <p>
     * Each candidate is re-checked inside {@link ConcurrentMap#computeIfPresent}, which holds the
     * same per-key lock as a hit. A hit racing with the sweep therefore either lands first and
     * keeps the bucket alive, or lands after removal and opens a fresh bucket.
     */
    @Override
    public int sweepIdleBuckets(long nowMs) {
        final var removed = new AtomicInteger();
        for (final var key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, counter) -> {
                if (counter.isIdle(nowMs, idleMultiplier)) {
                    removed.incrementAndGet();
                    return null;
                }
                return counter;
            });
        }
        return removed.get();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the current number of tracked rate limit buckets.
     *
     * @return the number of active buckets
     */
    public int bucketCount() {
        return buckets.size();
    }
}
