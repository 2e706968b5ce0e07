package net.spookly.proxygroup.group;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import lombok.extern.slf4j.Slf4j;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.ConnectionRefused;

/**
 * Turns dial outcomes into health-check escalations.
 * <p>
 * A refused connection escalates at once. Other failures accumulate; enough of them inside the
 * failure window escalate, while a sparse run resets the count. Escalation starts a sweep in the
 * background and never blocks or fails the reporting caller.
 */
@Slf4j
public final class FailureTracker {
    private final String groupName;
    private final FailureWindow failureWindow;
    private final HealthCheckCoordinator coordinator;
    private final Executor executor;
    private final Clock clock;

    FailureTracker(String groupName,
                   FailureWindow failureWindow,
                   HealthCheckCoordinator coordinator,
                   Executor executor,
                   Clock clock) {
        this.groupName = Objects.requireNonNull(groupName, "groupName");
        this.failureWindow = Objects.requireNonNull(failureWindow, "failureWindow");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void onDialFailure(BackendKind kind, Throwable error) {
        if (kind == null || !kind.countsTowardGroupHealth()) {
            return;
        }
        if (ConnectionRefused.matches(error)) {
            log.debug("ProxyGroup {}: connection refused, checking health now", groupName);
            triggerHealthCheck();
            return;
        }
        switch (failureWindow.recordFailure(clock.instant())) {
            case STARTED:
                log.debug("ProxyGroup {}: first failure", groupName);
                break;
            case COUNTED:
                log.debug("ProxyGroup {}: failure count {}", groupName, failureWindow.count());
                break;
            case EXPIRED:
                log.debug("ProxyGroup {}: failures too sparse, count reset", groupName);
                break;
            case ESCALATE:
                log.warn("ProxyGroup {}: failed multiple times, starting active health check", groupName);
                triggerHealthCheck();
                break;
            default:
                break;
        }
    }

    /**
     * Clear the failure count, unless a sweep is running and owns the outcome.
     */
    public void onDialSuccess() {
        if (!coordinator.isInFlight()) {
            failureWindow.reset();
        }
    }

    int failureCount() {
        return failureWindow.count();
    }

    private void triggerHealthCheck() {
        try {
            executor.execute(coordinator::runSweep);
        } catch (RejectedExecutionException e) {
            log.warn("ProxyGroup {}: health check not started, executor rejected it", groupName);
        }
    }
}
