package net.spookly.proxygroup.backend;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A single upstream endpoint a connection can be routed through.
 */
public interface Backend {
    /**
     * Stable identifier, used for de-duplication and as the probe result key.
     */
    String name();

    BackendKind kind();

    /**
     * Measure round-trip latency to the given URL through this backend.
     * Completes exceptionally when the backend is unreachable.
     */
    CompletableFuture<Duration> probe(ProbeContext context, String url);
}
