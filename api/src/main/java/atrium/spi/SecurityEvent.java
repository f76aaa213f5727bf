package atrium.spi;

import java.time.Instant;
import java.util.List;

/**
 * Sealed interface representing security events detected by the request pipeline.
 *
 * <p>Security events are dispatched to registered {@link atrium.spi.SecurityEventHandler}
 * implementations for alerting, logging, and metrics recording.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link RequestBlocked} - Request rejected by security validation</li>
 *   <li>{@link SuspiciousRequest} - Request allowed but tripped heuristics</li>
 *   <li>{@link RateLimitExceeded} - Client exceeded a rate-limit tier</li>
 *   <li>{@link PrivacyDenied} - Access to a profile denied by the privacy engine</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the client identifier (hashed IP).
     *
     * @return client identifier
     */
    String clientIdentifier();

    /**
     * Return the endpoint the request targeted.
     *
     * @return endpoint name
     */
    String endpoint();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * One-line description used by log-based handlers.
     *
     * @return formatted event
     */
    String describe();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events (e.g., an expected privacy denial). */
        INFO,
        /** Warning events requiring attention (e.g., heuristic hits). */
        WARNING,
        /** Critical events requiring immediate action (e.g., a blocked malicious payload). */
        CRITICAL
    }

    /**
     * Request rejected by security validation.
     *
     * @param timestamp        when the request was blocked
     * @param clientIdentifier hashed client IP
     * @param endpoint         target endpoint
     * @param method           HTTP method
     * @param userAgent        client user agent
     * @param reasons          validation errors
     */
    record RequestBlocked(
            Instant timestamp,
            String clientIdentifier,
            String endpoint,
            String method,
            String userAgent,
            List<String> reasons)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }

        @Override
        public String describe() {
            return String.format(
                    "BLOCKED: client=%s endpoint=%s method=%s ua=%s reasons=%s",
                    clientIdentifier, endpoint, method, userAgent, reasons);
        }
    }

    /**
     * Request allowed but flagged by heuristics.
     *
     * @param timestamp        when the request was seen
     * @param clientIdentifier hashed client IP
     * @param endpoint         target endpoint
     * @param userAgent        client user agent
     * @param warnings         heuristic findings
     */
    record SuspiciousRequest(
            Instant timestamp, String clientIdentifier, String endpoint, String userAgent, List<String> warnings)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String describe() {
            return String.format(
                    "SUSPICIOUS: client=%s endpoint=%s ua=%s warnings=%s",
                    clientIdentifier, endpoint, userAgent, warnings);
        }
    }

    /**
     * Rate limit exceeded event.
     *
     * @param timestamp        when the limit was exceeded
     * @param clientIdentifier hashed client IP
     * @param endpoint         target endpoint
     * @param tier             rate-limit tier
     * @param requestCount     hits in the current window
     * @param threshold        the tier's limit
     * @param windowSeconds    window length in seconds
     */
    record RateLimitExceeded(
            Instant timestamp,
            String clientIdentifier,
            String endpoint,
            String tier,
            long requestCount,
            long threshold,
            long windowSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return requestCount >= threshold * 2 ? Severity.WARNING : Severity.INFO;
        }

        @Override
        public String describe() {
            return String.format(
                    "RATE_LIMIT: client=%s endpoint=%s tier=%s requests=%d threshold=%d window=%ds",
                    clientIdentifier, endpoint, tier, requestCount, threshold, windowSeconds);
        }
    }

    /**
     * Privacy denial. The reason is internal and never returned to the caller.
     *
     * @param timestamp        when access was denied
     * @param clientIdentifier hashed client IP
     * @param endpoint         target endpoint
     * @param reason           internal violation reason (e.g., "private", "self-contact")
     */
    record PrivacyDenied(Instant timestamp, String clientIdentifier, String endpoint, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }

        @Override
        public String describe() {
            return String.format("PRIVACY_DENIED: client=%s endpoint=%s reason=%s", clientIdentifier, endpoint, reason);
        }
    }
}
