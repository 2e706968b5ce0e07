package net.spookly.proxygroup.config;

import java.util.List;
import java.util.Map;

public class GroupsConfig {
    public List<ProxyConfig> proxies;
    public Map<String, ProviderConfig> providers;
    public List<GroupConfig> groups;
    public ProbeConfig probe;

    public static class ProxyConfig {
        public String name;
        /**
         * One of: http, direct, reject.
         */
        public String type;
        public String host;
        public Integer port;
    }

    public static class ProviderConfig {
        /**
         * Names of entries in the top-level proxies list.
         */
        public List<String> proxies;
        public HealthCheckConfig healthCheck;
    }

    public static class HealthCheckConfig {
        public String url;
        public Integer timeoutMs;
    }

    public static class GroupConfig {
        public String name;
        /**
         * Backtick-separated regular expressions; empty keeps every member.
         */
        public String filter;
        public List<String> proxies;
        public List<String> use;
        public FailureConfig failure;
    }

    public static class FailureConfig {
        public Integer maxFailedTimes;
        public Integer windowMs;
    }

    public static class ProbeConfig {
        public String url;
        public Integer timeoutMs;
    }
}
