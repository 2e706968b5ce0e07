package net.spookly.proxygroup.config;

/**
 * Default configuration written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default proxygroup config.
            proxies:
              - name: hk-01
                type: http
                host: 127.0.0.1
                port: 8080
              - name: us-01
                type: http
                host: 127.0.0.1
                port: 8081

            providers:
              edge:
                proxies: [hk-01, us-01]
                healthCheck:
                  url: http://www.gstatic.com/generate_204
                  timeoutMs: 5000

            groups:
              - name: auto
                filter: "hk`us"
                use: [edge]
                failure:
                  maxFailedTimes: 5
                  windowMs: 5000

            probe:
              url: http://www.gstatic.com/generate_204
              timeoutMs: 5000
            """;

    private ConfigDefaults() {
    }

    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
