package atrium.core.service.common;

import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import atrium.core.model.common.ClientIdentity;
import atrium.core.model.common.InboundRequest;
import atrium.core.model.common.RequestHeaders;
import atrium.core.port.out.IdentityProvider;

/**
 * Derives the caller identity from an inbound request.
 *
 * <p>Client IP is resolved in the following order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter (first entry)</li>
 *   <li>Legacy {@code X-Forwarded-For} header (first IP in chain)</li>
 *   <li>{@code X-Real-IP}</li>
 *   <li>{@code CF-Connecting-IP}</li>
 *   <li>Socket connection's remote address</li>
 * </ol>
 */
@ApplicationScoped
public class ClientIdentityExtractor {

    private final IdentityProvider identityProvider;

    @Inject
    public ClientIdentityExtractor(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    public ClientIdentity extract(InboundRequest request) {
        final var headers = request.headers();
        final var ip = extractIp(headers, request.remoteAddress());
        final var origin = headers.first("Origin").filter(o -> !o.isBlank());
        return new ClientIdentity(ip, headers.get("User-Agent"), origin, identityProvider.authenticatedUserId(headers));
    }

    /**
     * Resolve the original client IP.
     *
     * @param headers       request headers
     * @param remoteAddress socket peer address, may be null
     * @return the client IP, or {@code unknown}
     */
    public static String extractIp(RequestHeaders headers, String remoteAddress) {
        final var forwarded = headers.get("Forwarded");
        if (forwarded != null) {
            final var forMatch = parseForwardedFor(forwarded);
            if (forMatch != null) {
                return forMatch;
            }
        }

        final var xForwardedFor = headers.get("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        return firstNonBlank(headers.get("X-Real-IP"), headers.get("CF-Connecting-IP"), remoteAddress)
                .orElse(ClientIdentity.UNKNOWN);
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                // IPv6 is bracketed, any port follows the bracket
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value.isBlank() ? null : value;
            }
        }
        return null;
    }

    private static Optional<String> firstNonBlank(String... candidates) {
        for (final var candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return Optional.of(candidate.trim());
            }
        }
        return Optional.empty();
    }
}
