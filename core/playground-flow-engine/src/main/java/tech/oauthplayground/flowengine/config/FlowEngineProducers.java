package tech.oauthplayground.flowengine.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CDI producers for the engine's infrastructure collaborators.
 *
 * <p>All are {@link DefaultBean}s so an application (or a test) can supply its own.
 */
@ApplicationScoped
public class FlowEngineProducers {

    private static final Logger LOG = Logger.getLogger(FlowEngineProducers.class);

    @Produces
    @ApplicationScoped
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Scheduler for device polling loops. Daemon threads, so an abandoned poll never
     * keeps the JVM alive.
     */
    @Produces
    @ApplicationScoped
    @DefaultBean
    public ScheduledExecutorService pollScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2, runnable -> {
            Thread thread = new Thread(runnable, "device-poller-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    void shutdownPollScheduler(@Disposes ScheduledExecutorService executor) {
        LOG.info("Shutting down device poll scheduler");
        executor.shutdownNow();
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
