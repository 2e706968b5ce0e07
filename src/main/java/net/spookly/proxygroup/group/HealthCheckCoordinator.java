package net.spookly.proxygroup.group;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;
import net.spookly.proxygroup.provider.ProxyProvider;

/**
 * Runs the health checks of all of a group's providers, at most one sweep at a time.
 */
@Slf4j
public final class HealthCheckCoordinator {
    private final String groupName;
    private final List<ProxyProvider> providers;
    private final FailureWindow failureWindow;
    private final Executor executor;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    /**
     * The executor must run provider checks while a sweep started on it is still waiting for them,
     * so a bounded pool of the sweep's own workers will not do.
     */
    HealthCheckCoordinator(String groupName,
                           List<ProxyProvider> providers,
                           FailureWindow failureWindow,
                           Executor executor) {
        this.groupName = Objects.requireNonNull(groupName, "groupName");
        this.providers = providers == null ? List.of() : List.copyOf(providers);
        this.failureWindow = Objects.requireNonNull(failureWindow, "failureWindow");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Check every provider concurrently and wait for all of them. Returns false without doing
     * anything when another sweep is already running. Provider failures are logged, not thrown.
     */
    public boolean runSweep() {
        if (!inFlight.compareAndSet(false, true)) {
            return false;
        }
        try {
            log.info("ProxyGroup {}: health check sweep over {} provider(s)", groupName, providers.size());
            List<CompletableFuture<Void>> checks = new ArrayList<>(providers.size());
            for (ProxyProvider provider : providers) {
                try {
                    checks.add(CompletableFuture.runAsync(() -> checkProvider(provider), executor));
                } catch (RejectedExecutionException e) {
                    log.warn("ProxyGroup {}: could not schedule health check for provider {}", groupName, provider.name(), e);
                }
            }
            CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();
            log.info("ProxyGroup {}: health check sweep finished", groupName);
        } finally {
            inFlight.set(false);
            failureWindow.reset();
        }
        return true;
    }

    public boolean isInFlight() {
        return inFlight.get();
    }

    private void checkProvider(ProxyProvider provider) {
        try {
            provider.runHealthCheck();
        } catch (RuntimeException e) {
            log.warn("ProxyGroup {}: health check of provider {} failed", groupName, provider.name(), e);
        }
    }
}
