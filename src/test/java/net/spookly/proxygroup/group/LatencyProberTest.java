package net.spookly.proxygroup.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.backend.SentinelBackend;
import net.spookly.proxygroup.provider.CompatibleProvider;
import net.spookly.proxygroup.provider.ProxyProvider;

class LatencyProberTest {
    private static final String URL = "http://www.gstatic.com/generate_204";
    private static final Backend FALLBACK = new SentinelBackend("COMPATIBLE", BackendKind.COMPATIBLE);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void omitsBackendsThatTimeOut() {
        LatencyProber prober = prober(
                new StubBackend("hk-1", Duration.ofMillis(40)),
                new StubBackend("us-1", Duration.ofMillis(60)),
                new StubBackend("jp-1", null)
        );

        Map<String, Duration> latencies = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> prober.probeAll(ProbeContext.withTimeout(Duration.ofMillis(300)), URL));

        assertEquals(Map.of("hk-1", Duration.ofMillis(40), "us-1", Duration.ofMillis(60)), latencies);
    }

    @Test
    void reportsAllProbesFailedWhenEveryProbeTimesOut() {
        LatencyProber prober = prober(
                new StubBackend("hk-1", null),
                new StubBackend("us-1", null),
                new StubBackend("jp-1", null)
        );

        AllProbesFailedException error = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertThrows(
                AllProbesFailedException.class,
                () -> prober.probeAll(ProbeContext.withTimeout(Duration.ofMillis(200)), URL)
        ));

        assertEquals(3, error.attempted());
        assertEquals("auto", error.groupName());
        assertInstanceOf(TimeoutException.class, error.getCause());
    }

    @Test
    void cancellationReleasesWaitingCaller() {
        LatencyProber prober = prober(new StubBackend("hk-1", null), new StubBackend("us-1", null));
        ProbeContext context = ProbeContext.background();
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS).execute(context::cancel);

        AllProbesFailedException error = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertThrows(
                AllProbesFailedException.class,
                () -> prober.probeAll(context, URL)
        ));

        assertInstanceOf(CancellationException.class, error.getCause());
    }

    @Test
    void groupWithoutBackendsReportsFailureInsteadOfEmptyResult() {
        LatencyProber prober = new LatencyProber("empty", new ProxySetResolver(List.of(), List.of(), FALLBACK), executor);

        assertThrows(AllProbesFailedException.class, () -> prober.probeAll(ProbeContext.withTimeout(Duration.ofSeconds(1)), URL));
    }

    @Test
    void failingProbesAreOmitted() {
        LatencyProber prober = prober(
                new StubBackend("hk-1", Duration.ofMillis(10)),
                new FailingBackend("us-1")
        );

        Map<String, Duration> latencies = prober.probeAll(ProbeContext.withTimeout(Duration.ofSeconds(2)), URL);

        assertEquals(Map.of("hk-1", Duration.ofMillis(10)), latencies);
    }

    private LatencyProber prober(Backend... backends) {
        List<ProxyProvider> providers = List.of(new CompatibleProvider("auto", List.of(backends)));
        return new LatencyProber("auto", new ProxySetResolver(List.of(), providers, FALLBACK), executor);
    }

    /**
     * Completes after the given latency, or never when latency is null.
     */
    private static final class StubBackend implements Backend {
        private final String name;
        private final Duration latency;

        private StubBackend(String name, Duration latency) {
            this.name = name;
            this.latency = latency;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public BackendKind kind() {
            return BackendKind.ROUTED;
        }

        @Override
        public CompletableFuture<Duration> probe(ProbeContext context, String url) {
            CompletableFuture<Duration> result = new CompletableFuture<>();
            if (latency != null) {
                CompletableFuture.delayedExecutor(latency.toMillis(), TimeUnit.MILLISECONDS)
                        .execute(() -> result.complete(latency));
            }
            return result;
        }
    }

    private static final class FailingBackend implements Backend {
        private final String name;

        private FailingBackend(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public BackendKind kind() {
            return BackendKind.ROUTED;
        }

        @Override
        public CompletableFuture<Duration> probe(ProbeContext context, String url) {
            throw new IllegalStateException("dial failed");
        }
    }
}
