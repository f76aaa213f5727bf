package atrium.core.model.ratelimit;

/**
 * Fixed-window counter state for one bucket. Immutable; every update produces a new instance.
 *
 * @param windowStartMs start of the current window
 * @param windowMs      window length
 * @param count         hits recorded in the window, including rejected ones
 * @param lastSeenMs    time of the most recent hit, used for idle eviction
 */
public record WindowCounter(long windowStartMs, long windowMs, long count, long lastSeenMs) {

    public static WindowCounter open(long nowMs, long windowMs) {
        return new WindowCounter(nowMs, windowMs, 1, nowMs);
    }

    /**
     * Register one hit at {@code nowMs}. A hit at or after the window end opens a new window.
     */
    public WindowCounter hit(long nowMs) {
        if (nowMs >= resetAtMs()) {
            return open(nowMs, windowMs);
        }
        return new WindowCounter(windowStartMs, windowMs, count + 1, Math.max(lastSeenMs, nowMs));
    }

    public long resetAtMs() {
        return windowStartMs + windowMs;
    }

    /**
     * A bucket is idle once no hit has arrived for {@code windowMs * idleMultiplier}. With a
     * multiplier of at least one, an idle bucket's window has always elapsed.
     */
    public boolean isIdle(long nowMs, int idleMultiplier) {
        return nowMs - lastSeenMs > windowMs * Math.max(1, idleMultiplier);
    }
}
