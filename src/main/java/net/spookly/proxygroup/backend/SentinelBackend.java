package net.spookly.proxygroup.backend;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Placeholder backend for the non-routable kinds (direct, reject, pass, compatible).
 */
@ToString
@EqualsAndHashCode
public final class SentinelBackend implements Backend {
    private final String name;
    private final BackendKind kind;

    public SentinelBackend(String name, BackendKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind == BackendKind.ROUTED) {
            throw new IllegalArgumentException("Sentinel backends cannot be routed: " + name);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public CompletableFuture<Duration> probe(ProbeContext context, String url) {
        return CompletableFuture.failedFuture(
                new UnsupportedOperationException(kind + " backend " + name + " cannot be probed"));
    }
}
