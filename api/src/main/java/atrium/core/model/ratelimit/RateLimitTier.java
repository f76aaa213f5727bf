package atrium.core.model.ratelimit;

import java.time.Duration;

/**
 * Named rate-limit policy.
 *
 * @param name        tier name, e.g. {@code search} or {@code mutate}
 * @param maxRequests requests admitted per window
 * @param windowMs    window length in milliseconds
 */
public record RateLimitTier(String name, long maxRequests, long windowMs) {

    public RateLimitTier {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name cannot be blank");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1: " + maxRequests);
        }
        if (windowMs < 1) {
            throw new IllegalArgumentException("windowMs must be positive: " + windowMs);
        }
    }

    public static RateLimitTier of(String name, long maxRequests, Duration window) {
        return new RateLimitTier(name, maxRequests, window.toMillis());
    }
}
