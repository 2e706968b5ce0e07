package net.spookly.proxygroup.group;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.regex.Pattern;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.provider.ProxyProvider;
import net.spookly.proxygroup.provider.VehicleKind;

/**
 * Builds a group's effective backend list from its providers.
 * <p>
 * With filters configured, each provider's filtered list is cached against the provider's
 * version. A stale slot is recomputed only by the caller that wins the compare-and-set on the
 * slot's version, so a version bump costs one recompute no matter how many callers race.
 * A slot pairs an immutable list with the version it was computed from, and a slot computed from
 * an older version never replaces a newer one.
 */
public final class ProxySetResolver {
    private static final long NEVER_COMPUTED = -1L;

    private final List<Pattern> filters;
    private final List<ProxyProvider> providers;
    private final Backend fallback;
    private final AtomicReferenceArray<Slot> slots;
    private final AtomicLongArray claimedVersions;

    public ProxySetResolver(List<Pattern> filters, List<ProxyProvider> providers, Backend fallback) {
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.providers = providers == null ? List.of() : List.copyOf(providers);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.slots = new AtomicReferenceArray<>(this.providers.size());
        this.claimedVersions = new AtomicLongArray(this.providers.size());
        for (int i = 0; i < this.providers.size(); i++) {
            slots.set(i, new Slot(NEVER_COMPUTED, List.of()));
            claimedVersions.set(i, NEVER_COMPUTED);
        }
    }

    /**
     * Resolve the current backend list, optionally touching every provider first.
     * Never returns an empty list: the fallback backend stands in when nothing is eligible.
     */
    public List<Backend> resolve(boolean forceRefresh) {
        if (filters.isEmpty()) {
            return resolveUnfiltered(forceRefresh);
        }

        for (int i = 0; i < providers.size(); i++) {
            ProxyProvider provider = providers.get(i);
            if (forceRefresh) {
                provider.touch();
            }
            refreshSlot(i, provider);
        }

        List<Backend> combined = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            combined.addAll(slots.get(i).backends());
        }
        if (combined.isEmpty()) {
            return List.of(fallback);
        }
        if (providers.size() > 1 && filters.size() > 1) {
            return List.copyOf(select(combined, true));
        }
        return List.copyOf(combined);
    }

    /**
     * Touch every provider without resolving.
     */
    public void touchAll() {
        for (ProxyProvider provider : providers) {
            provider.touch();
        }
    }

    private List<Backend> resolveUnfiltered(boolean forceRefresh) {
        List<Backend> combined = new ArrayList<>();
        for (ProxyProvider provider : providers) {
            if (forceRefresh) {
                provider.touch();
            }
            combined.addAll(nullSafe(provider.currentBackends()));
        }
        if (combined.isEmpty()) {
            return List.of(fallback);
        }
        return List.copyOf(combined);
    }

    private void refreshSlot(int index, ProxyProvider provider) {
        long live = provider.version();
        if (provider.vehicleKind() == VehicleKind.COMPATIBLE) {
            // Passthrough lists are authoritative and cheap; take them as-is on every call.
            claimedVersions.set(index, live);
            publish(index, new Slot(live, List.copyOf(nullSafe(provider.currentBackends()))));
            return;
        }
        long claimed = claimedVersions.get(index);
        if (claimed != live && claimedVersions.compareAndSet(index, claimed, live)) {
            publish(index, new Slot(live, List.copyOf(select(nullSafe(provider.currentBackends()), false))));
        }
    }

    private void publish(int index, Slot computed) {
        slots.accumulateAndGet(index, computed, (current, next) -> next.version() >= current.version() ? next : current);
    }

    /**
     * Apply the filters in order, first match by name wins. Unmatched backends are dropped, or
     * appended in their original order when {@code appendUnmatched} is set.
     */
    private List<Backend> select(List<Backend> candidates, boolean appendUnmatched) {
        List<Backend> selected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Pattern filter : filters) {
            for (Backend backend : candidates) {
                String name = backend.name();
                if (filter.matcher(name).find() && seen.add(name)) {
                    selected.add(backend);
                }
            }
        }
        if (appendUnmatched) {
            for (Backend backend : candidates) {
                if (seen.add(backend.name())) {
                    selected.add(backend);
                }
            }
        }
        return selected;
    }

    private static List<Backend> nullSafe(List<Backend> backends) {
        return backends == null ? List.of() : backends;
    }

    private record Slot(long version, List<Backend> backends) {
    }
}
