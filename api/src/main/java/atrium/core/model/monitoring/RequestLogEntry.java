package atrium.core.model.monitoring;

/**
 * One completed request. Held in the raw log until it is rolled up into an hourly aggregate.
 */
public record RequestLogEntry(
        String requestId,
        String endpoint,
        String method,
        int status,
        String ip,
        String userAgent,
        long requestSize,
        long responseSize,
        long durationMs,
        String errorCode,
        String errorMessage,
        long timestampMs) {

    /** Requests in the 2xx and 3xx range count as successful. */
    public boolean isSuccess() {
        return status >= 200 && status < 400;
    }
}
