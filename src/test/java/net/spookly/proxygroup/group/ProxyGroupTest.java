package net.spookly.proxygroup.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.FallbackRegistry;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.provider.ProxyProvider;
import net.spookly.proxygroup.provider.VehicleKind;

class ProxyGroupTest {
    @Test
    void resolvesThroughFiltersAndFallsBackWhenEmpty() {
        StubProvider provider = new StubProvider(List.of(new StubBackend("hk-1"), new StubBackend("jp-1")));
        FallbackRegistry registry = FallbackRegistry.withDefaults();
        try (ProxyGroup group = ProxyGroup.create("auto", "hk", List.of(provider), registry, FailurePolicy.DEFAULT);
             ProxyGroup empty = ProxyGroup.create("none", "", List.of(), registry, FailurePolicy.DEFAULT)) {
            assertEquals("hk-1", group.resolve(false).get(0).name());
            assertEquals(1, group.resolve(false).size());
            assertEquals(List.of(registry.lookup(FallbackRegistry.COMPATIBLE)), empty.resolve(false));
        }
    }

    @Test
    void touchReachesEveryProvider() {
        StubProvider first = new StubProvider(List.of());
        StubProvider second = new StubProvider(List.of());
        try (ProxyGroup group = ProxyGroup.create("auto", "", List.of(first, second), FallbackRegistry.withDefaults(), null)) {
            group.touch();
        }
        assertEquals(1, first.touches.get());
        assertEquals(1, second.touches.get());
    }

    @Test
    void refusedDialStartsBackgroundSweep() throws Exception {
        StubProvider provider = new StubProvider(List.of(new StubBackend("hk-1")));
        try (ProxyGroup group = ProxyGroup.create("auto", "", List.of(provider), FallbackRegistry.withDefaults(), FailurePolicy.DEFAULT)) {
            group.onDialFailure(BackendKind.ROUTED, new ConnectException("Connection refused"));

            assertTrue(provider.checked.await(5, TimeUnit.SECONDS));
            assertEquals(0, group.failureCount());
        }
    }

    @Test
    void explicitHealthCheckRunsOnCaller() {
        StubProvider provider = new StubProvider(List.of());
        try (ProxyGroup group = ProxyGroup.create("auto", "", List.of(provider), FallbackRegistry.withDefaults(), FailurePolicy.DEFAULT)) {
            assertTrue(group.healthCheck());
            assertFalse(group.isHealthCheckInFlight());
            assertEquals(0, provider.checked.getCount());
        }
    }

    @Test
    void triggeredSweepFinishesOnGroupWorkers() throws Exception {
        StubProvider first = new StubProvider(List.of(new StubBackend("hk-1")));
        StubProvider second = new StubProvider(List.of(new StubBackend("us-1")));
        AtomicInteger threads = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "edge-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        try (ProxyGroup group = new ProxyGroup(
                "edge",
                List.of(),
                List.of(first, second),
                FallbackRegistry.withDefaults().lookup(FallbackRegistry.COMPATIBLE),
                FailurePolicy.DEFAULT,
                threadFactory,
                Clock.systemUTC())) {
            group.onDialFailure(BackendKind.ROUTED, new ConnectException("Connection refused"));

            assertTrue(first.checked.await(5, TimeUnit.SECONDS));
            assertTrue(second.checked.await(5, TimeUnit.SECONDS));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (group.isHealthCheckInFlight() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertFalse(group.isHealthCheckInFlight());
            assertTrue(group.healthCheck());
            assertTrue(threads.get() >= 2);
        }
    }

    @Test
    void requiresCompatibleFallback() {
        assertThrows(IllegalStateException.class,
                () -> ProxyGroup.create("auto", "", List.of(), new FallbackRegistry(), FailurePolicy.DEFAULT));
    }

    private static final class StubBackend implements Backend {
        private final String name;

        private StubBackend(String name) {
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
            return CompletableFuture.completedFuture(Duration.ofMillis(5));
        }
    }

    private static final class StubProvider implements ProxyProvider {
        private final List<Backend> backends;
        private final AtomicInteger touches = new AtomicInteger();
        private final CountDownLatch checked = new CountDownLatch(1);

        private StubProvider(List<Backend> backends) {
            this.backends = backends;
        }

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public void touch() {
            touches.incrementAndGet();
        }

        @Override
        public List<Backend> currentBackends() {
            return backends;
        }

        @Override
        public long version() {
            return 1L;
        }

        @Override
        public VehicleKind vehicleKind() {
            return VehicleKind.INLINE;
        }

        @Override
        public void runHealthCheck() {
            checked.countDown();
        }
    }
}
