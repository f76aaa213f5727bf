package atrium.core.model.common;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CORS policy applied to agent-facing responses.
 *
 * <p>An empty origin list means the API is open to any origin and responses carry
 * {@code Access-Control-Allow-Origin: *}. Otherwise the caller's origin is echoed back only
 * when it matches an entry, where {@code *.example.com} matches subdomains but not the apex.
 */
public record CorsPolicy(
        List<String> allowedOrigins, List<String> allowedMethods, List<String> allowedHeaders, long maxAgeSeconds) {

    public CorsPolicy {
        allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of();
        allowedMethods = allowedMethods != null ? List.copyOf(allowedMethods) : List.of("GET", "POST", "OPTIONS");
        allowedHeaders = allowedHeaders != null
                ? List.copyOf(allowedHeaders)
                : List.of("Content-Type", "Authorization", "X-Requested-With");
    }

    /**
     * Creates a policy that allows any origin.
     */
    public static CorsPolicy openToAll() {
        return new CorsPolicy(List.of(), null, null, 86400);
    }

    /**
     * Checks whether a request from the given origin is acceptable.
     *
     * @param origin the Origin header value, may be null for non-browser callers
     * @return true if no origin was sent, no allow-list is configured, or the origin matches
     */
    public boolean isOriginPermitted(String origin) {
        if (origin == null || origin.isBlank() || allowedOrigins.isEmpty() || allowedOrigins.contains("*")) {
            return true;
        }
        return allowedOrigins.stream().anyMatch(allowed -> matchesOrigin(allowed, origin));
    }

    /**
     * Resolves the {@code Access-Control-Allow-Origin} value for a caller.
     *
     * @param origin the Origin header value, may be null
     * @return the header value, or empty when the origin is not allowed
     */
    public Optional<String> allowOriginFor(String origin) {
        if (allowedOrigins.isEmpty() || allowedOrigins.contains("*")) {
            return Optional.of("*");
        }
        if (origin != null && isOriginPermitted(origin)) {
            return Optional.of(origin);
        }
        return Optional.empty();
    }

    /**
     * Builds the CORS response headers for a caller.
     */
    public Map<String, String> headersFor(String origin) {
        final var headers = new LinkedHashMap<String, String>();
        allowOriginFor(origin).ifPresent(value -> {
            headers.put("Access-Control-Allow-Origin", value);
            if (!"*".equals(value)) {
                headers.put("Vary", "Origin");
            }
        });
        headers.put("Access-Control-Allow-Methods", String.join(", ", allowedMethods));
        headers.put("Access-Control-Allow-Headers", String.join(", ", allowedHeaders));
        headers.put("Access-Control-Max-Age", String.valueOf(maxAgeSeconds));
        return headers;
    }

    private boolean matchesOrigin(String pattern, String origin) {
        if (pattern.equals(origin)) {
            return true;
        }
        // *.example.com matches subdomains only
        if (pattern.startsWith("*.")) {
            final var domain = pattern.substring(2);
            return origin.endsWith("." + domain);
        }
        return false;
    }
}
