package atrium.core.service.ratelimit;

import java.util.Map;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import atrium.core.config.RateLimitingConfig;
import atrium.core.model.ratelimit.RateLimitTier;

/**
 * Resolves configured rate-limit tiers by name.
 *
 * <p>Unknown tier names resolve to the {@code default} tier, or to a built-in 100 requests per
 * minute when no default is configured.
 */
@ApplicationScoped
public class RateLimitTierRegistry {

    private static final Logger LOG = Logger.getLogger(RateLimitTierRegistry.class);

    public static final String DEFAULT_TIER = "default";
    private static final RateLimitTier BUILT_IN_DEFAULT = new RateLimitTier(DEFAULT_TIER, 100, 60_000);

    private final Map<String, RateLimitTier> tiers;

    @Inject
    public RateLimitTierRegistry(RateLimitingConfig config) {
        final var resolved = new TreeMap<String, RateLimitTier>();
        config.tiers().forEach((name, tier) ->
                resolved.put(name, new RateLimitTier(name, tier.maxRequests(), tier.window().toMillis())));
        this.tiers = Map.copyOf(resolved);
        LOG.infov("Loaded {0} rate limit tier(s): {1}", tiers.size(), tiers.values());
    }

    public RateLimitTierRegistry(Map<String, RateLimitTier> tiers) {
        this.tiers = Map.copyOf(tiers);
    }

    public RateLimitTier resolve(String name) {
        final var tier = tiers.get(name);
        if (tier != null) {
            return tier;
        }
        LOG.debugv("Unknown rate limit tier {0}, using default", name);
        return tiers.getOrDefault(DEFAULT_TIER, BUILT_IN_DEFAULT);
    }
}
