package atrium.adapter.out.ratelimit.redis;

import java.util.function.LongSupplier;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import atrium.core.model.ratelimit.RateLimitDecision;
import atrium.core.model.ratelimit.RateLimitKey;
import atrium.core.model.ratelimit.RateLimitTier;
import atrium.core.port.out.RateLimiter;

/**
 * Redis-backed fixed-window rate limiter for multi-instance deployments.
 *
 * <p>Each bucket is a single integer key incremented by an atomic Lua script. The key expires with
 * its window, so Redis performs idle eviction and {@link #sweepIdleBuckets} has nothing to do.
 *
 * <p>If Redis is unavailable the limiter fails open: the request is admitted and a warning is
 * logged, so a store outage does not take the API down.
 */
public class RedisRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(RedisRateLimiter.class);

    /**
     * KEYS[1] bucket key, ARGV[1] window in ms. Returns {hits, remaining ttl ms}.
     */
    static final String FIXED_WINDOW_SCRIPT =
            """
            local hits = redis.call('INCR', KEYS[1])
            if hits == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return {hits, ttl}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final boolean enabled;
    private final LongSupplier clock;

    public RedisRateLimiter(ReactiveRedisDataSource redisDataSource, boolean enabled, LongSupplier clock) {
        this.redisDataSource = redisDataSource;
        this.enabled = enabled;
        this.clock = clock;
    }

    public RedisRateLimiter(ReactiveRedisDataSource redisDataSource, boolean enabled) {
        this(redisDataSource, enabled, System::currentTimeMillis);
    }

    @Override
    public Uni<RateLimitDecision> checkLimit(String clientKey, RateLimitTier tier) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited());
        }

        final var key = new RateLimitKey(clientKey, tier.name()).toCacheKey();
        final var nowMs = clock.getAsLong();

        // EVAL script numkeys key arg
        return redisDataSource
                .execute("EVAL", FIXED_WINDOW_SCRIPT, "1", key, String.valueOf(tier.windowMs()))
                .map(response -> parseDecision(response, tier, nowMs))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Rate limit check failed for tier {0}, allowing request", tier.name());
                    return RateLimitDecision.unlimited();
                });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return redisDataSource
                .execute("DEL", key.toCacheKey())
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Failed to reset rate limit key: {0}", key.toCacheKey());
                    return null;
                });
    }

    @Override
    public int sweepIdleBuckets(long nowMs) {
        // Keys expire with their window
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    private RateLimitDecision parseDecision(Response response, RateLimitTier tier, long nowMs) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from Redis rate limit script");
        }
        final var hits = response.get(0).toLong();
        final var ttlMs = Math.max(0, response.get(1).toLong());
        return RateLimitDecision.fromCount(hits, tier.maxRequests(), nowMs + ttlMs);
    }
}
