package net.spookly.proxygroup;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.FallbackRegistry;
import net.spookly.proxygroup.backend.ProbeContext;
import net.spookly.proxygroup.config.ConfigLoader;
import net.spookly.proxygroup.config.GroupsConfig;
import net.spookly.proxygroup.group.AllProbesFailedException;
import net.spookly.proxygroup.group.ProxyGroup;

/**
 * Command line entry point: loads groups, prints their members and optionally probes them.
 */
@Slf4j
public final class ProxyGroupMain {
    private static final String DEFAULT_CONFIG = "config/proxygroup.yaml";
    private static final String DEFAULT_PROBE_URL = "http://www.gstatic.com/generate_204";
    private static final int DEFAULT_PROBE_TIMEOUT_MS = 5000;

    private ProxyGroupMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        GroupsConfig config = ConfigLoader.load(options.configPath);
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        log.info("Loaded {} group(s) from {}", config.groups.size(), options.configPath);

        try (GroupAssembler assembler = GroupAssembler.assemble(config, FallbackRegistry.withDefaults())) {
            for (ProxyGroup group : assembler.groups().values()) {
                printMembers(group, group.resolve(options.refresh));
                if (options.probe) {
                    probe(group, config.probe);
                }
            }
        }
    }

    private static void printMembers(ProxyGroup group, List<Backend> members) {
        StringBuilder builder = new StringBuilder(group.name()).append(':');
        for (Backend member : members) {
            builder.append(' ').append(member.name());
        }
        System.out.println(builder);
    }

    private static void probe(ProxyGroup group, GroupsConfig.ProbeConfig probe) {
        String url = probe == null || probe.url == null ? DEFAULT_PROBE_URL : probe.url;
        int timeoutMs = probe == null || probe.timeoutMs == null ? DEFAULT_PROBE_TIMEOUT_MS : probe.timeoutMs;
        try {
            Map<String, Duration> latencies = group.probeAll(ProbeContext.withTimeout(Duration.ofMillis(timeoutMs)), url);
            for (Map.Entry<String, Duration> entry : latencies.entrySet()) {
                System.out.println("  " + entry.getKey() + " " + entry.getValue().toMillis() + "ms");
            }
        } catch (AllProbesFailedException e) {
            System.out.println("  " + e.getMessage());
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean probe = false;
        boolean refresh = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, probe, refresh);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--probe".equals(arg)) {
                probe = true;
                continue;
            }
            if ("--refresh".equals(arg)) {
                refresh = true;
            }
        }
        return new CliOptions(configPath, dryRun, probe, refresh);
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean probe, boolean refresh) {
    }
}
