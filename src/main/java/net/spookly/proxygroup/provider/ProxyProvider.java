package net.spookly.proxygroup.provider;

import java.util.List;

import net.spookly.proxygroup.backend.Backend;

/**
 * Versioned source of backend candidates shared by one or more groups.
 */
public interface ProxyProvider {
    String name();

    /**
     * Hint the provider to refresh its upstream list. Must not block.
     */
    void touch();

    /**
     * Present backend list. Cheap; no I/O on the hot path.
     */
    List<Backend> currentBackends();

    /**
     * Monotonically non-decreasing; bumped whenever {@link #currentBackends()} would change.
     */
    long version();

    VehicleKind vehicleKind();

    /**
     * Run the provider's own liveness checks. May block.
     */
    void runHealthCheck();
}
