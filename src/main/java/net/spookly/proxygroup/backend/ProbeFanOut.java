package net.spookly.proxygroup.backend;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;

/**
 * Probes a set of backends concurrently and waits for every probe to settle.
 */
@Slf4j
public final class ProbeFanOut {
    private ProbeFanOut() {
    }

    /**
     * Launch one probe per backend on the executor and block until all of them finish or the
     * context is done. Failed and cancelled probes are left out of the result; when names collide
     * the later backend in the list wins.
     */
    public static Map<String, Duration> run(List<Backend> backends,
                                            ProbeContext context,
                                            String url,
                                            Executor executor) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(executor, "executor");
        if (backends == null || backends.isEmpty()) {
            return Map.of();
        }
        AtomicReferenceArray<Duration> latencies = new AtomicReferenceArray<>(backends.size());
        List<CompletableFuture<Void>> barrier = new ArrayList<>(backends.size());
        for (int i = 0; i < backends.size(); i++) {
            int index = i;
            Backend backend = backends.get(i);
            barrier.add(probeOne(backend, context, url, executor).handle((latency, error) -> {
                if (error == null && latency != null) {
                    latencies.set(index, latency);
                } else {
                    log.debug("Probe of {} failed: {}", backend.name(), describe(error));
                }
                return null;
            }));
        }
        CompletableFuture.allOf(barrier.toArray(new CompletableFuture[0])).join();

        Map<String, Duration> results = new LinkedHashMap<>();
        for (int i = 0; i < backends.size(); i++) {
            Duration latency = latencies.get(i);
            if (latency != null) {
                results.put(backends.get(i).name(), latency);
            }
        }
        return results;
    }

    private static CompletableFuture<Duration> probeOne(Backend backend,
                                                        ProbeContext context,
                                                        String url,
                                                        Executor executor) {
        CompletableFuture<Duration> attempt;
        try {
            attempt = CompletableFuture.supplyAsync(() -> backend.probe(context, url), executor)
                    .thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Duration> bounded = new CompletableFuture<>();
        attempt.whenComplete((latency, error) -> {
            if (error != null) {
                bounded.completeExceptionally(error);
            } else {
                bounded.complete(latency);
            }
        });
        Runnable detach = context.whenDone(bounded::completeExceptionally);
        bounded.whenComplete((latency, error) -> {
            detach.run();
            if (!attempt.isDone()) {
                attempt.cancel(true);
            }
        });
        return bounded;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "no latency reported";
        }
        Throwable cause = error.getCause() != null && error instanceof CompletionException
                ? error.getCause()
                : error;
        return cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    }
}
