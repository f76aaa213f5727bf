package atrium.core.model.monitoring;

/**
 * Token returned by {@code startRequest} and passed back to {@code endRequest}.
 *
 * @param requestId   id in the form {@code req_<epochms>_<random>}
 * @param endpoint    logical endpoint name
 * @param method      HTTP method
 * @param startNanos  monotonic start time from {@link System#nanoTime()}
 * @param startedAtMs wall-clock start time
 */
public record RequestHandle(String requestId, String endpoint, String method, long startNanos, long startedAtMs) {}
