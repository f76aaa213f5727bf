package atrium.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies a rate-limit bucket: one per client key and tier.
 *
 * <p>Cache key format: {@code atrium:ratelimit:{tier}:{clientKey}}
 *
 * @param clientKey the caller key (user id, or IP plus truncated user agent)
 * @param tier      the tier name
 */
public record RateLimitKey(String clientKey, String tier) {

    private static final String PREFIX = "atrium:ratelimit:";

    public RateLimitKey {
        Objects.requireNonNull(clientKey, "clientKey must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
    }

    public String toCacheKey() {
        return PREFIX + tier + ":" + clientKey;
    }
}
