package net.spookly.proxygroup.group;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.FallbackRegistry;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.provider.ProxyProvider;

/**
 * Shared state of one proxy group: resolves its members, tracks dial failures, coordinates
 * provider health checks and probes latency. Selection policies sit on top of this.
 * <p>
 * Wiring is fixed at construction; reconfiguration replaces the whole group.
 */
public final class ProxyGroup implements AutoCloseable {
    private final String name;
    private final ProxySetResolver resolver;
    private final HealthCheckCoordinator coordinator;
    private final FailureTracker failureTracker;
    private final LatencyProber prober;
    private final ExecutorService executor;

    /**
     * Create a group with daemon workers named after the group and the system clock.
     */
    public static ProxyGroup create(String name,
                                    String filter,
                                    List<ProxyProvider> providers,
                                    FallbackRegistry fallbackRegistry,
                                    FailurePolicy failurePolicy) {
        Objects.requireNonNull(name, "name");
        return new ProxyGroup(
                name,
                FilterPatterns.compile(filter),
                providers,
                fallbackBackend(fallbackRegistry),
                failurePolicy,
                threadFactory(name),
                Clock.systemUTC()
        );
    }

    /**
     * Create a group whose workers come from the given thread factory.
     * <p>
     * The group always runs on its own unbounded cached pool: a triggered sweep occupies one
     * worker while it waits for the provider checks it schedules on the same pool.
     */
    public ProxyGroup(String name,
                      List<Pattern> filters,
                      List<ProxyProvider> providers,
                      Backend fallback,
                      FailurePolicy failurePolicy,
                      ThreadFactory threadFactory,
                      Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(threadFactory, "threadFactory");
        Objects.requireNonNull(clock, "clock");
        FailureWindow failureWindow = new FailureWindow(failurePolicy == null ? FailurePolicy.DEFAULT : failurePolicy);
        this.resolver = new ProxySetResolver(filters, providers, fallback);
        this.executor = Executors.newCachedThreadPool(threadFactory);
        this.coordinator = new HealthCheckCoordinator(name, providers, failureWindow, executor);
        this.failureTracker = new FailureTracker(name, failureWindow, coordinator, executor, clock);
        this.prober = new LatencyProber(name, resolver, executor);
    }

    public String name() {
        return name;
    }

    /**
     * Current members in resolution order; never empty.
     */
    public List<Backend> resolve(boolean forceRefresh) {
        return resolver.resolve(forceRefresh);
    }

    /**
     * Ask every provider to refresh its upstream list.
     */
    public void touch() {
        resolver.touchAll();
    }

    public void onDialFailure(BackendKind kind, Throwable error) {
        failureTracker.onDialFailure(kind, error);
    }

    public void onDialSuccess() {
        failureTracker.onDialSuccess();
    }

    /**
     * Probe every current member; see {@link LatencyProber#probeAll(ProbeContext, String)}.
     */
    public Map<String, Duration> probeAll(ProbeContext context, String url) {
        return prober.probeAll(context, url);
    }

    /**
     * Run a provider sweep on the calling thread. Returns false if one was already running.
     */
    public boolean healthCheck() {
        return coordinator.runSweep();
    }

    public boolean isHealthCheckInFlight() {
        return coordinator.isInFlight();
    }

    int failureCount() {
        return failureTracker.failureCount();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Backend fallbackBackend(FallbackRegistry registry) {
        Objects.requireNonNull(registry, "fallbackRegistry");
        Backend fallback = registry.lookup(FallbackRegistry.COMPATIBLE);
        if (fallback == null) {
            throw new IllegalStateException("Fallback registry has no " + FallbackRegistry.COMPATIBLE + " backend");
        }
        return fallback;
    }

    private static ThreadFactory threadFactory(String groupName) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "proxygroup-" + groupName + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
