package net.spookly.proxygroup.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.proxygroup.group.FilterPatterns;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(GroupsConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        Set<String> proxyNames = validateProxies(config, errors);
        validateProviders(config, proxyNames, errors);
        validateGroups(config, proxyNames, errors);
        validateProbe(config, errors);

        throwIfErrors(errors);
    }

    private static Set<String> validateProxies(GroupsConfig config, List<String> errors) {
        Set<String> names = new HashSet<>();
        if (config.proxies == null) {
            return names;
        }
        for (GroupsConfig.ProxyConfig proxy : config.proxies) {
            if (proxy == null) {
                continue;
            }
            requireNonBlank(errors, proxy.name, "proxies.name");
            if (!isBlank(proxy.name) && !names.add(proxy.name)) {
                errors.add("proxy name must be unique: " + proxy.name);
            }
            String label = "proxies." + (isBlank(proxy.name) ? "?" : proxy.name);
            requireNonBlank(errors, proxy.type, label + ".type");
            if (!isBlank(proxy.type) && !isOneOf(proxy.type, "http", "direct", "reject")) {
                errors.add(label + ".type must be one of: http, direct, reject");
            }
            if ("http".equalsIgnoreCase(proxy.type)) {
                requireNonBlank(errors, proxy.host, label + ".host");
                requirePort(errors, proxy.port, label + ".port");
            }
        }
        return names;
    }

    private static void validateProviders(GroupsConfig config, Set<String> proxyNames, List<String> errors) {
        if (config.providers == null) {
            return;
        }
        for (Map.Entry<String, GroupsConfig.ProviderConfig> entry : config.providers.entrySet()) {
            String label = "providers." + entry.getKey();
            GroupsConfig.ProviderConfig provider = entry.getValue();
            if (provider == null) {
                errors.add(label + " is required");
                continue;
            }
            requireKnownProxies(errors, provider.proxies, proxyNames, label + ".proxies");
            if (provider.healthCheck != null) {
                requireNonBlank(errors, provider.healthCheck.url, label + ".healthCheck.url");
                requirePositive(errors, provider.healthCheck.timeoutMs, label + ".healthCheck.timeoutMs");
            }
        }
    }

    private static void validateGroups(GroupsConfig config, Set<String> proxyNames, List<String> errors) {
        if (config.groups == null || config.groups.isEmpty()) {
            errors.add("groups must include at least one group");
            return;
        }
        Set<String> groupNames = new HashSet<>();
        for (GroupsConfig.GroupConfig group : config.groups) {
            if (group == null) {
                continue;
            }
            requireNonBlank(errors, group.name, "groups.name");
            if (!isBlank(group.name) && !groupNames.add(group.name)) {
                errors.add("group name must be unique: " + group.name);
            }
            String label = "groups." + (isBlank(group.name) ? "?" : group.name);
            boolean hasProxies = group.proxies != null && !group.proxies.isEmpty();
            boolean hasProviders = group.use != null && !group.use.isEmpty();
            if (!hasProxies && !hasProviders) {
                errors.add(label + " must list proxies or use at least one provider");
            }
            requireKnownProxies(errors, group.proxies, proxyNames, label + ".proxies");
            if (group.use != null) {
                for (String providerName : group.use) {
                    if (isBlank(providerName) || config.providers == null || !config.providers.containsKey(providerName)) {
                        errors.add(label + ".use must reference an existing provider: " + providerName);
                    }
                }
            }
            try {
                FilterPatterns.compile(group.filter);
            } catch (IllegalArgumentException e) {
                errors.add(label + ".filter " + e.getMessage());
            }
            if (group.failure != null) {
                requirePositive(errors, group.failure.maxFailedTimes, label + ".failure.maxFailedTimes");
                requirePositive(errors, group.failure.windowMs, label + ".failure.windowMs");
            }
        }
    }

    private static void validateProbe(GroupsConfig config, List<String> errors) {
        if (config.probe == null) {
            return;
        }
        requireNonBlank(errors, config.probe.url, "probe.url");
        requirePositive(errors, config.probe.timeoutMs, "probe.timeoutMs");
    }

    private static void requireKnownProxies(List<String> errors, List<String> names, Set<String> known, String field) {
        if (names == null) {
            return;
        }
        for (String name : names) {
            if (isBlank(name) || !known.contains(name)) {
                errors.add(field + " must reference an existing proxy: " + name);
            }
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
