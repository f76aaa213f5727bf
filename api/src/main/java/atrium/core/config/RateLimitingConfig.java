package atrium.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code atrium.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code ATRIUM_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code ATRIUM_RATE_LIMITING_STORE} - {@code MEMORY} (per process) or {@code REDIS} (shared)</li>
 *   <li>{@code ATRIUM_RATE_LIMITING_TIERS__SEARCH__MAX_REQUESTS} - per-tier override</li>
 * </ul>
 */
@ConfigMapping(prefix = "atrium.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Where bucket state lives. Multi-instance deployments need {@code REDIS} so that every
     * instance sees the same counters.
     */
    enum Store {
        MEMORY,
        REDIS
    }

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * @return bucket store (default: MEMORY)
     */
    @WithDefault("MEMORY")
    Store store();

    /**
     * Buckets idle for longer than {@code windowMs * idleMultiplier} are evicted by the sweep.
     *
     * @return idle multiplier (default: 4)
     */
    @WithName("idle-multiplier")
    @WithDefault("4")
    int idleMultiplier();

    /**
     * @return interval between idle-bucket sweeps (default: 60s)
     */
    @WithName("sweep-interval")
    @WithDefault("60s")
    Duration sweepInterval();

    /**
     * @return whether X-RateLimit-* headers are added to responses (default: true)
     */
    @WithName("include-headers")
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Named tiers. Endpoints reference a tier by name; unknown names fall back to {@code default}.
     *
     * @return tier definitions keyed by name
     */
    Map<String, TierConfig> tiers();

    /**
     * Limits for one tier.
     */
    interface TierConfig {

        @WithName("max-requests")
        long maxRequests();

        @WithDefault("60s")
        Duration window();
    }
}
