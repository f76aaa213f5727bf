package atrium.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate-limit check.
 *
 * @param allowed           whether the request is admitted
 * @param remaining         requests left in the current window
 * @param limit             the tier's maximum per window
 * @param resetTimeEpochMs  end of the current window
 * @param totalHitsInWindow hits seen in the window including this one
 */
public record RateLimitDecision(
        boolean allowed, long remaining, long limit, long resetTimeEpochMs, long totalHitsInWindow) {

    /**
     * Create an "allowed" decision for when rate limiting is disabled or the store is unavailable.
     *
     * @return an allowed decision with no meaningful window
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, 0);
    }

    /**
     * Decide from a post-increment hit count.
     */
    public static RateLimitDecision fromCount(long hits, long limit, long resetTimeEpochMs) {
        return new RateLimitDecision(hits <= limit, Math.max(0, limit - hits), limit, resetTimeEpochMs, hits);
    }

    public boolean isUnlimited() {
        return limit == Long.MAX_VALUE;
    }

    /**
     * Seconds the caller should wait before retrying, rounded up and never below one.
     */
    public long retryAfterSeconds(long nowMs) {
        final var waitMs = resetTimeEpochMs - nowMs;
        return Math.max(1, (waitMs + 999) / 1000);
    }

    /** @return reset time in epoch seconds, rounded up, for response headers */
    public long resetEpochSeconds() {
        return (resetTimeEpochMs + 999) / 1000;
    }

    public Instant resetTime() {
        return Instant.ofEpochMilli(resetTimeEpochMs);
    }
}
