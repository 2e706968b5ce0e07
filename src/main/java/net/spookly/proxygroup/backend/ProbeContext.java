package net.spookly.proxygroup.backend;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Cancellation signal and optional deadline shared by the probes of one operation.
 * Once done, the context stays done and reports the cause.
 */
public final class ProbeContext {
    private final AtomicReference<Throwable> cause = new AtomicReference<>();
    private final Set<Listener> listeners = ConcurrentHashMap.newKeySet();
    private final long deadlineNanos;
    private final boolean bounded;

    private ProbeContext(long deadlineNanos, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    /**
     * A context that is only done once cancelled.
     */
    public static ProbeContext background() {
        return new ProbeContext(0L, false);
    }

    /**
     * A context that becomes done when the timeout elapses or it is cancelled, whichever is first.
     */
    public static ProbeContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long timeoutNanos = Math.max(0L, timeout.toNanos());
        ProbeContext context = new ProbeContext(System.nanoTime() + timeoutNanos, true);
        CompletableFuture.delayedExecutor(timeoutNanos, TimeUnit.NANOSECONDS)
                .execute(() -> context.finish(new TimeoutException("probe deadline of " + timeout.toMillis() + "ms exceeded")));
        return context;
    }

    public void cancel() {
        finish(new CancellationException("probe cancelled"));
    }

    public boolean isDone() {
        return cause.get() != null;
    }

    /**
     * Why the context is done, or null while it is still live.
     */
    public Throwable cause() {
        return cause.get();
    }

    /**
     * Time left before the deadline, or the given value when the context has no deadline.
     */
    public Duration remaining(Duration whenUnbounded) {
        if (!bounded) {
            return whenUnbounded;
        }
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * Run the callback with the cause once the context is done; runs immediately if already done.
     * Returns an action that detaches the callback; probes detach once they settle.
     */
    public Runnable whenDone(Consumer<Throwable> callback) {
        Objects.requireNonNull(callback, "callback");
        Listener listener = new Listener(callback);
        listeners.add(listener);
        Throwable reason = cause.get();
        if (reason != null) {
            fire(listener, reason);
        }
        return () -> listeners.remove(listener);
    }

    int pendingCallbacks() {
        return listeners.size();
    }

    private void finish(Throwable reason) {
        if (cause.compareAndSet(null, reason)) {
            for (Listener listener : listeners) {
                fire(listener, reason);
            }
        }
    }

    private void fire(Listener listener, Throwable reason) {
        listeners.remove(listener);
        if (listener.fired.compareAndSet(false, true)) {
            listener.callback.accept(reason);
        }
    }

    private static final class Listener {
        private final Consumer<Throwable> callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Listener(Consumer<Throwable> callback) {
            this.callback = callback;
        }
    }
}
