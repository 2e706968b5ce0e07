package net.spookly.proxygroup.provider;

/**
 * How a provider obtains its backend list.
 */
public enum VehicleKind {
    /**
     * Members declared in configuration and pruned by the provider's own health checks.
     */
    INLINE,
    /**
     * Passthrough of a group's directly listed members; always treated as fresh.
     */
    COMPATIBLE
}
