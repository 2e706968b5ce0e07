package net.spookly.proxygroup.group;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.backend.ProbeFanOut;

/**
 * Measures latency to a URL through every backend the group currently resolves to.
 */
public final class LatencyProber {
    private final String groupName;
    private final ProxySetResolver resolver;
    private final Executor executor;

    LatencyProber(String groupName, ProxySetResolver resolver, Executor executor) {
        this.groupName = Objects.requireNonNull(groupName, "groupName");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Probe all backends concurrently and block until every probe has finished or the context
     * is done. Backends whose probe failed are absent from the result.
     *
     * @throws AllProbesFailedException when no probe succeeded
     */
    public Map<String, Duration> probeAll(ProbeContext context, String url) {
        Objects.requireNonNull(context, "context");
        List<Backend> backends = resolver.resolve(false);
        Map<String, Duration> latencies = ProbeFanOut.run(backends, context, url, executor);
        if (latencies.isEmpty()) {
            throw new AllProbesFailedException(groupName, backends.size(), context.cause());
        }
        return latencies;
    }
}
