package net.spookly.proxygroup;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.FallbackRegistry;
import net.spookly.proxygroup.backend.HttpProxyBackend;
import net.spookly.proxygroup.backend.SentinelBackend;
import net.spookly.proxygroup.config.GroupsConfig;
import net.spookly.proxygroup.group.FailurePolicy;
import net.spookly.proxygroup.group.ProxyGroup;
import net.spookly.proxygroup.provider.CompatibleProvider;
import net.spookly.proxygroup.provider.InlineProxyProvider;
import net.spookly.proxygroup.provider.ProxyProvider;

/**
 * Builds backends, providers and groups from a validated configuration and owns their resources.
 */
public final class GroupAssembler implements AutoCloseable {
    static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final EventLoopGroup workerGroup;
    private final ExecutorService providerExecutor;
    private final Map<String, ProxyGroup> groups;

    private GroupAssembler(EventLoopGroup workerGroup,
                           ExecutorService providerExecutor,
                           Map<String, ProxyGroup> groups) {
        this.workerGroup = workerGroup;
        this.providerExecutor = providerExecutor;
        this.groups = groups;
    }

    /**
     * Assemble every configured group, sharing providers between groups that use the same one.
     */
    public static GroupAssembler assemble(GroupsConfig config, FallbackRegistry fallbackRegistry) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(fallbackRegistry, "fallbackRegistry");
        EventLoopGroup workerGroup = new NioEventLoopGroup();
        ExecutorService providerExecutor = Executors.newCachedThreadPool(threadFactory());
        Clock clock = Clock.systemUTC();

        Map<String, Backend> backends = new LinkedHashMap<>();
        if (config.proxies != null) {
            for (GroupsConfig.ProxyConfig proxy : config.proxies) {
                if (proxy != null) {
                    backends.put(proxy.name, backend(proxy, workerGroup));
                }
            }
        }

        Map<String, ProxyProvider> providers = new LinkedHashMap<>();
        if (config.providers != null) {
            for (Map.Entry<String, GroupsConfig.ProviderConfig> entry : config.providers.entrySet()) {
                GroupsConfig.ProviderConfig provider = entry.getValue();
                GroupsConfig.HealthCheckConfig healthCheck = provider.healthCheck;
                providers.put(entry.getKey(), new InlineProxyProvider(
                        entry.getKey(),
                        lookup(backends, provider.proxies),
                        healthCheck == null ? null : healthCheck.url,
                        healthCheck == null || healthCheck.timeoutMs == null
                                ? DEFAULT_HEALTH_CHECK_TIMEOUT
                                : Duration.ofMillis(healthCheck.timeoutMs),
                        providerExecutor,
                        clock
                ));
            }
        }

        Map<String, ProxyGroup> groups = new LinkedHashMap<>();
        for (GroupsConfig.GroupConfig group : config.groups) {
            if (group == null) {
                continue;
            }
            List<ProxyProvider> groupProviders = new ArrayList<>();
            if (group.proxies != null && !group.proxies.isEmpty()) {
                groupProviders.add(new CompatibleProvider(group.name, lookup(backends, group.proxies)));
            }
            if (group.use != null) {
                for (String providerName : group.use) {
                    groupProviders.add(providers.get(providerName));
                }
            }
            groups.put(group.name, ProxyGroup.create(
                    group.name,
                    group.filter,
                    groupProviders,
                    fallbackRegistry,
                    failurePolicy(group.failure)
            ));
        }
        return new GroupAssembler(workerGroup, providerExecutor, Collections.unmodifiableMap(groups));
    }

    /**
     * Groups in configuration order.
     */
    public Map<String, ProxyGroup> groups() {
        return groups;
    }

    @Override
    public void close() {
        for (ProxyGroup group : groups.values()) {
            group.close();
        }
        providerExecutor.shutdownNow();
        workerGroup.shutdownGracefully();
    }

    static Backend backend(GroupsConfig.ProxyConfig proxy, EventLoopGroup workerGroup) {
        String type = proxy.type == null ? "" : proxy.type.trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "http":
                return new HttpProxyBackend(proxy.name, proxy.host, proxy.port, workerGroup);
            case "direct":
                return new SentinelBackend(proxy.name, BackendKind.DIRECT);
            case "reject":
                return new SentinelBackend(proxy.name, BackendKind.REJECT);
            default:
                throw new IllegalArgumentException("Unsupported proxy type: " + proxy.type);
        }
    }

    static FailurePolicy failurePolicy(GroupsConfig.FailureConfig failure) {
        if (failure == null) {
            return FailurePolicy.DEFAULT;
        }
        int maxFailedTimes = failure.maxFailedTimes == null
                ? FailurePolicy.DEFAULT_MAX_FAILED_TIMES
                : failure.maxFailedTimes;
        Duration window = failure.windowMs == null
                ? FailurePolicy.DEFAULT_WINDOW
                : Duration.ofMillis(failure.windowMs);
        return new FailurePolicy(maxFailedTimes, window);
    }

    private static List<Backend> lookup(Map<String, Backend> backends, List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        List<Backend> results = new ArrayList<>(names.size());
        for (String name : names) {
            Backend backend = backends.get(name);
            if (backend == null) {
                throw new IllegalArgumentException("Unknown proxy: " + name);
            }
            results.add(backend);
        }
        return results;
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "proxygroup-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
