package net.spookly.proxygroup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.Test;

import net.spookly.proxygroup.backend.Backend;
import net.spookly.proxygroup.backend.BackendKind;
import net.spookly.proxygroup.backend.FallbackRegistry;
import net.spookly.proxygroup.backend.HttpProxyBackend;
import net.spookly.proxygroup.config.ConfigValidator;
import net.spookly.proxygroup.config.GroupsConfig;
import net.spookly.proxygroup.group.FailurePolicy;
import net.spookly.proxygroup.group.ProxyGroup;

class GroupAssemblerTest {
    @Test
    void buildsGroupsFromConfig() {
        GroupsConfig config = config();
        ConfigValidator.validate(config);

        try (GroupAssembler assembler = GroupAssembler.assemble(config, FallbackRegistry.withDefaults())) {
            assertEquals(List.of("auto", "all"), new ArrayList<>(assembler.groups().keySet()));

            ProxyGroup auto = assembler.groups().get("auto");
            List<Backend> members = auto.resolve(false);
            assertEquals(List.of("hk-01", "us-01", "local"), names(members));
            assertInstanceOf(HttpProxyBackend.class, members.get(0));
            assertEquals(BackendKind.DIRECT, members.get(2).kind());

            ProxyGroup all = assembler.groups().get("all");
            assertEquals(List.of("hk-01", "us-01", "jp-01", "us-01", "hk-01"), names(all.resolve(true)));
        }
    }

    @Test
    void failurePolicyDefaultsFillGaps() {
        GroupsConfig.FailureConfig failure = new GroupsConfig.FailureConfig();
        failure.windowMs = 2000;

        FailurePolicy policy = GroupAssembler.failurePolicy(failure);

        assertEquals(FailurePolicy.DEFAULT_MAX_FAILED_TIMES, policy.maxFailedTimes());
        assertEquals(Duration.ofSeconds(2), policy.window());
        assertEquals(FailurePolicy.DEFAULT, GroupAssembler.failurePolicy(null));
    }

    private GroupsConfig config() {
        GroupsConfig config = new GroupsConfig();
        config.proxies = new ArrayList<>();
        config.proxies.add(proxy("hk-01", "http"));
        config.proxies.add(proxy("us-01", "http"));
        config.proxies.add(proxy("jp-01", "http"));
        config.proxies.add(proxy("local", "direct"));
        config.providers = new LinkedHashMap<>();
        GroupsConfig.ProviderConfig edge = new GroupsConfig.ProviderConfig();
        edge.proxies = List.of("jp-01", "us-01", "hk-01");
        config.providers.put("edge", edge);

        GroupsConfig.GroupConfig auto = new GroupsConfig.GroupConfig();
        auto.name = "auto";
        auto.filter = "hk`us";
        auto.proxies = List.of("local");
        auto.use = List.of("edge");

        GroupsConfig.GroupConfig all = new GroupsConfig.GroupConfig();
        all.name = "all";
        all.proxies = List.of("hk-01", "us-01");
        all.use = List.of("edge");

        config.groups = new ArrayList<>(List.of(auto, all));
        return config;
    }

    private GroupsConfig.ProxyConfig proxy(String name, String type) {
        GroupsConfig.ProxyConfig proxy = new GroupsConfig.ProxyConfig();
        proxy.name = name;
        proxy.type = type;
        proxy.host = "127.0.0.1";
        proxy.port = 18080;
        return proxy;
    }

    private static List<String> names(List<Backend> backends) {
        List<String> names = new ArrayList<>();
        for (Backend backend : backends) {
            names.add(backend.name());
        }
        return names;
    }
}
