package atrium.core.port.out;

import io.smallrye.mutiny.Uni;

import atrium.core.model.ratelimit.RateLimitDecision;
import atrium.core.model.ratelimit.RateLimitKey;
import atrium.core.model.ratelimit.RateLimitTier;

/**
 * Port interface for rate-limit storage and enforcement.
 *
 * <p>Implementations count hits per {@link RateLimitKey} in fixed windows. Increments for the
 * same key must never be lost under concurrent access.
 */
public interface RateLimiter {

    /**
     * Record a hit and decide whether it is admitted.
     *
     * @param clientKey the caller key
     * @param tier      the tier whose limits apply
     * @return the decision, including remaining budget and window end
     */
    Uni<RateLimitDecision> checkLimit(String clientKey, RateLimitTier tier);

    /**
     * Forget all state for a bucket.
     *
     * @param key the bucket to reset
     * @return completion signal
     */
    Uni<Void> reset(RateLimitKey key);

    /**
     * Evict buckets idle longer than their tier window times {@code idleMultiplier}.
     *
     * @param nowMs current time in epoch milliseconds
     * @return number of buckets removed
     */
    int sweepIdleBuckets(long nowMs);

    /**
     * @return whether rate limiting is enabled
     */
    boolean isEnabled();
}
