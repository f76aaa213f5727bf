package atrium.adapter.out.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import atrium.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import atrium.adapter.out.ratelimit.redis.RedisRateLimiter;
import atrium.core.config.RateLimitingConfig;
import atrium.core.port.out.RateLimiter;

/**
 * Produces the {@link RateLimiter} selected by {@code atrium.rate-limiting.store}.
 *
 * <p>The store is an explicit deployment decision: {@code MEMORY} keeps counters per process,
 * {@code REDIS} shares them across instances. The Redis data source is only resolved when the
 * Redis store is selected.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config, Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public RateLimiter rateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled");
        }
        return switch (config.store()) {
            case REDIS -> {
                if (!redisDataSource.isResolvable()) {
                    throw new IllegalStateException(
                            "atrium.rate-limiting.store=REDIS but no Redis data source is configured");
                }
                LOG.info("Using Redis rate limiter");
                yield new RedisRateLimiter(redisDataSource.get(), config.enabled());
            }
            case MEMORY -> {
                LOG.info("Using in-memory rate limiter");
                yield new InMemoryRateLimiter(config.enabled(), config.idleMultiplier());
            }
        };
    }
}
