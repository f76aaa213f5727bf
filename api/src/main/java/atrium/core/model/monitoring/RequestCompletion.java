package atrium.core.model.monitoring;

/**
 * Outcome details supplied when a request finishes.
 *
 * @param status       HTTP status sent
 * @param ip           client IP
 * @param userAgent    client user agent
 * @param requestSize  request body size in bytes
 * @param responseSize response body size in bytes
 * @param errorCode    error code for failed requests, may be null
 * @param errorMessage error message for failed requests, may be null
 */
public record RequestCompletion(
        int status,
        String ip,
        String userAgent,
        long requestSize,
        long responseSize,
        String errorCode,
        String errorMessage) {

    public static RequestCompletion success(int status, String ip, String userAgent, long requestSize, long responseSize) {
        return new RequestCompletion(status, ip, userAgent, requestSize, responseSize, null, null);
    }
}
