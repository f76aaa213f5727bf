package atrium.core.model.common;

import java.util.Optional;

/**
 * Caller identity derived once per request.
 *
 * @param ip                  client IP after proxy-header resolution, or {@code unknown}
 * @param userAgent           user agent, or {@code unknown}
 * @param origin              CORS origin header, if sent
 * @param authenticatedUserId user id supplied by the identity provider, if any
 */
public record ClientIdentity(String ip, String userAgent, Optional<String> origin, Optional<String> authenticatedUserId) {

    public static final String UNKNOWN = "unknown";
    private static final int USER_AGENT_KEY_LENGTH = 50;

    public ClientIdentity {
        ip = ip == null || ip.isBlank() ? UNKNOWN : ip;
        userAgent = userAgent == null || userAgent.isBlank() ? UNKNOWN : userAgent;
        origin = origin != null ? origin : Optional.empty();
        authenticatedUserId = authenticatedUserId != null ? authenticatedUserId : Optional.empty();
    }

    public static ClientIdentity anonymous(String ip, String userAgent) {
        return new ClientIdentity(ip, userAgent, Optional.empty(), Optional.empty());
    }

    /** @return the viewer id for access-control decisions, or null when anonymous */
    public String viewerId() {
        return authenticatedUserId.orElse(null);
    }

    /**
     * Key under which this caller is rate limited.
     *
     * <p>Authenticated callers are keyed by user id so that rotating IPs does not reset their
     * budget. Anonymous callers are keyed by IP plus a truncated user agent.
     */
    public String rateLimitKey() {
        return authenticatedUserId
                .map(id -> "user:" + id)
                .orElseGet(() -> "ip:" + ip + ":"
                        + userAgent.substring(0, Math.min(USER_AGENT_KEY_LENGTH, userAgent.length())));
    }

    /** Short, non-reversible form of the IP for audit logs. */
    public String hashedIp() {
        final var hash = Integer.toHexString(ip.hashCode());
        return hash.substring(0, Math.min(8, hash.length()));
    }
}
