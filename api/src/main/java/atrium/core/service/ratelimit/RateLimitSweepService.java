package atrium.core.service.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import atrium.core.port.out.RateLimiter;

/**
 * Periodically evicts idle rate-limit buckets so memory stays bounded by the number of active
 * clients rather than every client ever seen.
 */
@ApplicationScoped
public class RateLimitSweepService {

    private static final Logger LOG = Logger.getLogger(RateLimitSweepService.class);

    private final RateLimiter rateLimiter;

    @Inject
    public RateLimitSweepService(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(
            every = "${atrium.rate-limiting.sweep-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweep() {
        if (!rateLimiter.isEnabled()) {
            return;
        }
        final var removed = rateLimiter.sweepIdleBuckets(System.currentTimeMillis());
        if (removed > 0) {
            LOG.debugv("Evicted {0} idle rate limit bucket(s)", removed);
        }
    }
}
