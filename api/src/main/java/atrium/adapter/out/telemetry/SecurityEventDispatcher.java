package atrium.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import atrium.core.config.MonitoringConfig;
import atrium.core.port.out.Metrics;
import atrium.core.port.out.SecurityEventPublisher;
import atrium.spi.SecurityEvent;
import atrium.spi.SecurityEventHandler;

/**
 * Fans security audit events out to the {@link SecurityEventHandler}s found on the class path.
 *
 * <p>Delivery runs on one daemon thread fed by a bounded queue. A hostile client can produce one
 * event per rejected request, so when the queue is full the newest event is discarded and counted
 * as {@code atrium.security.events.dropped} instead of holding it in memory.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final MeterRegistry meterRegistry;
    private final Metrics metrics;
    private final boolean enabled;
    private final int queueCapacity;

    private List<SecurityEventHandler> handlers = List.of();
    private ThreadPoolExecutor executor;

    @Inject
    public SecurityEventDispatcher(MonitoringConfig config, MeterRegistry meterRegistry, Metrics metrics) {
        this.meterRegistry = meterRegistry;
        this.metrics = metrics;
        this.enabled = config.securityEventsEnabled();
        this.queueCapacity = Math.max(1, config.securityEventQueueCapacity());
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security events disabled, audit events will not be delivered");
            return;
        }
        start(ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList());
    }

    /**
     * Start delivering to the given handlers. Unavailable handlers are skipped and the rest run
     * highest priority first.
     */
    void start(List<SecurityEventHandler> candidates) {
        candidates.stream()
                .filter(MetricsSecurityEventHandler.class::isInstance)
                .map(MetricsSecurityEventHandler.class::cast)
                .forEach(handler -> handler.setMeterRegistry(meterRegistry));

        handlers = candidates.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        if (handlers.isEmpty()) {
            LOG.warn("No security event handler available, audit events will only be counted");
            return;
        }
        LOG.infov(
                "Security event handlers: {0} (queue capacity {1})",
                handlers.stream().map(SecurityEventHandler::name).toList(),
                queueCapacity);

        executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    final var thread = new Thread(runnable, "atrium-security-events");
                    thread.setDaemon(true);
                    return thread;
                },
                dropNewest());
    }

    private RejectedExecutionHandler dropNewest() {
        return (task, pool) -> {
            final var type = task instanceof Delivery delivery
                    ? delivery.event().getClass().getSimpleName()
                    : "unknown";
            metrics.recordSecurityEventDropped(type);
            LOG.debugv("Security event queue full, dropped {0}", type);
        };
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        for (final var handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnv(e, "Security event handler {0} failed to close", handler.name());
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void publish(SecurityEvent event) {
        if (executor == null) {
            return;
        }
        executor.execute(new Delivery(event, handlers));
    }

    /**
     * @return active handlers in delivery order, empty when disabled
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }

    private record Delivery(SecurityEvent event, List<SecurityEventHandler> handlers) implements Runnable {

        @Override
        public void run() {
            for (final var handler : handlers) {
                try {
                    handler.handle(event);
                } catch (RuntimeException e) {
                    LOG.warnv(e, "Security event handler {0} rejected {1}", handler.name(), event.describe());
                }
            }
        }
    }
}
