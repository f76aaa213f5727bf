package atrium.core.model.monitoring;

import java.time.Duration;

/**
 * Aggregation bucket size.
 */
public enum Granularity {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1));

    private final Duration length;

    Granularity(Duration length) {
        this.length = length;
    }

    public long lengthMs() {
        return length.toMillis();
    }

    /** Truncate an epoch-millis timestamp to the start of its bucket (UTC). */
    public long truncate(long epochMs) {
        return Math.floorDiv(epochMs, lengthMs()) * lengthMs();
    }
}
