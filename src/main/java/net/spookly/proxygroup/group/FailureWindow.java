package net.spookly.proxygroup.group;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Failure count and window start of one group. All access goes through the lock.
 */
final class FailureWindow {
    enum Outcome {
        /** First failure; the window starts now. */
        STARTED,
        /** Counted inside the window, below the threshold. */
        COUNTED,
        /** The window had already elapsed; the count went back to zero. */
        EXPIRED,
        /** Counted inside the window and the threshold is reached. */
        ESCALATE
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final int threshold;
    private final Duration window;
    private int failureCount;
    private Instant lastFailureTime;

    FailureWindow(FailurePolicy policy) {
        Objects.requireNonNull(policy, "policy");
        this.threshold = policy.maxFailedTimes();
        this.window = policy.window();
    }

    Outcome recordFailure(Instant now) {
        lock.lock();
        try {
            failureCount++;
            if (failureCount == 1) {
                lastFailureTime = now;
                return threshold <= 1 ? Outcome.ESCALATE : Outcome.STARTED;
            }
            if (Duration.between(lastFailureTime, now).compareTo(window) > 0) {
                failureCount = 0;
                return Outcome.EXPIRED;
            }
            return failureCount >= threshold ? Outcome.ESCALATE : Outcome.COUNTED;
        } finally {
            lock.unlock();
        }
    }

    void reset() {
        lock.lock();
        try {
            failureCount = 0;
        } finally {
            lock.unlock();
        }
    }

    int count() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }
}
