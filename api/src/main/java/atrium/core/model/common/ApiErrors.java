package atrium.core.model.common;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import atrium.core.model.validation.FieldViolation;

/**
 * Factory for the error envelopes produced by the request pipeline and the exception mappers.
 *
 * <p>Messages are fixed strings or caller-supplied validation messages. Nothing here accepts an
 * exception, so stack traces and storage errors cannot reach a response body.
 */
public final class ApiErrors {

    public static final String RESOURCE_NOT_FOUND = "resource not found";

    private ApiErrors() {
        // Utility class - prevent instantiation
    }

    // ========== Validation Errors ==========

    public static ApiError validation(String message) {
        return of(message, ErrorCode.VALIDATION_ERROR, null);
    }

    public static ApiError validation(String message, List<FieldViolation> violations) {
        return of(message, ErrorCode.VALIDATION_ERROR, Map.of("violations", violations));
    }

    public static ApiError invalidJson(String reason) {
        return of("Invalid JSON in request body", ErrorCode.INVALID_JSON, Map.of("reason", reason));
    }

    // ========== Security Errors ==========

    public static ApiError securityRejected(List<String> reasons) {
        return of(
                "Request blocked for security reasons",
                ErrorCode.SECURITY_VALIDATION_FAILED,
                Map.of("reasons", reasons));
    }

    public static ApiError methodNotAllowed(String method, List<String> allowed) {
        return of(
                "Method %s not allowed".formatted(method),
                ErrorCode.METHOD_NOT_ALLOWED,
                Map.of("allowedMethods", allowed));
    }

    public static ApiError rateLimited(long retryAfterSeconds, Instant resetTime) {
        return of(
                "Rate limit exceeded",
                ErrorCode.RATE_LIMIT_EXCEEDED,
                Map.of(
                        "message", "Too many requests. Try again in %d seconds.".formatted(retryAfterSeconds),
                        "retryAfter", retryAfterSeconds,
                        "resetTime", resetTime.toString()));
    }

    // ========== Authentication / Authorization ==========

    public static ApiError unauthenticated() {
        return of("Authentication required", ErrorCode.UNAUTHENTICATED, null);
    }

    public static ApiError forbidden() {
        return of("Forbidden", ErrorCode.FORBIDDEN, null);
    }

    // ========== Not Found ==========

    public static ApiError notFound() {
        return of(RESOURCE_NOT_FOUND, ErrorCode.NOT_FOUND, null);
    }

    // ========== Server Errors ==========

    public static ApiError internal() {
        return of("An unexpected error occurred", ErrorCode.INTERNAL_SERVER_ERROR, null);
    }

    public static ApiError timeout() {
        return of("Request timed out", ErrorCode.REQUEST_TIMEOUT, null);
    }

    public static ApiError of(String message, ErrorCode code, Map<String, Object> details) {
        return new ApiError(message, code, Instant.now().toString(), details);
    }
}
