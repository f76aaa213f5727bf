package atrium.core.port.out;

import atrium.core.model.common.RiskLevel;

/**
 * Port interface for recording request-gate metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed request.
     *
     * @param endpoint   the logical endpoint name
     * @param method     the HTTP method
     * @param statusCode the response status code
     * @param durationMs request duration in milliseconds
     */
    void recordRequest(String endpoint, String method, int statusCode, long durationMs);

    /**
     * Record a rate-limit check.
     *
     * @param tier      the tier checked
     * @param allowed   whether the request was admitted
     * @param remaining remaining requests in the window
     */
    void recordRateLimitCheck(String tier, boolean allowed, long remaining);

    /**
     * Record a non-safe security finding.
     *
     * @param endpoint the endpoint name
     * @param level    the risk level
     * @param blocked  whether the request was rejected
     */
    void recordSecurityFinding(String endpoint, RiskLevel level, boolean blocked);

    /**
     * Record a privacy denial.
     *
     * @param endpoint the endpoint name
     * @param reason   the internal violation reason
     */
    void recordPrivacyDenial(String endpoint, String reason);

    /**
     * Record a request that exceeded the pipeline timeout.
     *
     * @param endpoint the endpoint name
     */
    void recordTimeout(String endpoint);

    /**
     * Record a security event that was discarded because the dispatch queue was full.
     *
     * @param eventType the event type name
     */
    void recordSecurityEventDropped(String eventType);
}
