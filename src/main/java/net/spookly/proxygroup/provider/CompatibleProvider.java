package net.spookly.proxygroup.provider;

import java.util.List;
import java.util.Objects;

import net.spookly.proxygroup.backend.Backend;

/**
 * Wraps the members a group lists directly. The list never changes after construction.
 */
public final class CompatibleProvider implements ProxyProvider {
    private final String name;
    private final List<Backend> backends;

    public CompatibleProvider(String name, List<Backend> backends) {
        this.name = Objects.requireNonNull(name, "name");
        this.backends = backends == null ? List.of() : List.copyOf(backends);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void touch() {
    }

    @Override
    public List<Backend> currentBackends() {
        return backends;
    }

    @Override
    public long version() {
        return 0L;
    }

    @Override
    public VehicleKind vehicleKind() {
        return VehicleKind.COMPATIBLE;
    }

    @Override
    public void runHealthCheck() {
    }
}
