package net.spookly.proxygroup.provider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;
import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.backend.ProbeFanOut;

/**
 * Provider whose members come from configuration. Health checks probe every member and
 * hide the ones that fail until a later check sees them recover.
 */
@Slf4j
public final class InlineProxyProvider implements ProxyProvider {
    private final String name;
    private final List<Backend> members;
    private final String healthCheckUrl;
    private final Duration healthCheckTimeout;
    private final Executor executor;
    private final Clock clock;
    private final AtomicLong version = new AtomicLong();
    private final AtomicReference<Instant> lastTouched = new AtomicReference<>();
    private volatile List<Backend> alive;

    /**
     * Create a provider; a blank health-check url disables health checks.
     */
    public InlineProxyProvider(String name,
                               List<Backend> members,
                               String healthCheckUrl,
                               Duration healthCheckTimeout,
                               Executor executor,
                               Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.members = members == null ? List.of() : List.copyOf(members);
        this.healthCheckUrl = healthCheckUrl;
        this.healthCheckTimeout = Objects.requireNonNull(healthCheckTimeout, "healthCheckTimeout");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.alive = this.members;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void touch() {
        lastTouched.set(clock.instant());
    }

    /**
     * When the provider was last touched, or null if never.
     */
    public Instant lastTouched() {
        return lastTouched.get();
    }

    @Override
    public List<Backend> currentBackends() {
        return alive;
    }

    @Override
    public long version() {
        return version.get();
    }

    @Override
    public VehicleKind vehicleKind() {
        return VehicleKind.INLINE;
    }

    @Override
    public void runHealthCheck() {
        if (healthCheckUrl == null || healthCheckUrl.isBlank() || members.isEmpty()) {
            return;
        }
        ProbeContext context = ProbeContext.withTimeout(healthCheckTimeout);
        Map<String, Duration> latencies = ProbeFanOut.run(members, context, healthCheckUrl, executor);
        List<Backend> next = new ArrayList<>();
        for (Backend member : members) {
            if (latencies.containsKey(member.name())) {
                next.add(member);
            }
        }
        updateAlive(List.copyOf(next));
        log.info("Provider {} health check: {}/{} members alive", name, next.size(), members.size());
    }

    private synchronized void updateAlive(List<Backend> next) {
        if (next.equals(alive)) {
            return;
        }
        alive = next;
        version.incrementAndGet();
    }
}
