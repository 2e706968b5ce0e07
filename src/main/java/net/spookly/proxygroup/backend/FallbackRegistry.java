package net.spookly.proxygroup.backend;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide lookup of always-available backends, used when a group resolves to nothing.
 */
public final class FallbackRegistry {
    public static final String COMPATIBLE = "COMPATIBLE";

    private final Map<String, Backend> backends = new ConcurrentHashMap<>();

    /**
     * Registry pre-populated with the built-in sentinel backends.
     */
    public static FallbackRegistry withDefaults() {
        FallbackRegistry registry = new FallbackRegistry();
        registry.register(new SentinelBackend("DIRECT", BackendKind.DIRECT));
        registry.register(new SentinelBackend("REJECT", BackendKind.REJECT));
        registry.register(new SentinelBackend("PASS", BackendKind.PASS));
        registry.register(new SentinelBackend(COMPATIBLE, BackendKind.COMPATIBLE));
        return registry;
    }

    public void register(Backend backend) {
        Objects.requireNonNull(backend, "backend");
        backends.put(backend.name(), backend);
    }

    /**
     * Look up a registered backend, or null when the key is unknown.
     */
    public Backend lookup(String key) {
        if (key == null) {
            return null;
        }
        return backends.get(key);
    }
}
