package atrium.core.model.common;

/**
 * Machine-readable error codes carried in every error envelope, with the HTTP status each maps to.
 */
public enum ErrorCode {
    VALIDATION_ERROR(400),
    INVALID_JSON(400),
    SECURITY_VALIDATION_FAILED(400),
    UNAUTHENTICATED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    CONFLICT(409),
    RATE_LIMIT_EXCEEDED(429),
    CLIENT_CLOSED_REQUEST(499),
    INTERNAL_SERVER_ERROR(500),
    REQUEST_TIMEOUT(504);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
