package com.ciaagent.shared.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".cia", "config.yaml"
    );

    public static CiaConfig load() {
        return load(DEFAULT_PATH);
    }

    public static CiaConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static CiaConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var oauth = (Map<String, Object>) raw.getOrDefault("oauth", Map.of());
        var mcp = (Map<String, Object>) raw.getOrDefault("mcp", Map.of());

        var defaults = ReliabilityConfig.defaults();
        var reliability = new ReliabilityConfig(
            Integer.parseInt(envOrDefault(env, "CIA_RETRIES",
                String.valueOf(raw.getOrDefault("retries", defaults.retries())))),
            Boolean.parseBoolean(envOrDefault(env, "CIA_RETRY_BACKOFF",
                String.valueOf(raw.getOrDefault("retry-backoff", defaults.backoff())))),
            Long.parseLong(envOrDefault(env, "CIA_RETRY_TIMEOUT",
                String.valueOf(raw.getOrDefault("retry-timeout", defaults.retryTimeoutMs())))),
            Boolean.parseBoolean(envOrDefault(env, "CIA_CONTRACT_VALIDATION",
                String.valueOf(raw.getOrDefault("contract-validation", defaults.contractValidation()))))
        );

        var oauthDefaults = OAuthSettings.defaults();
        var tokenDir = oauth.get("token-dir");
        var oauthSettings = new OAuthSettings(
            Integer.parseInt(envOrDefault(env, "CIA_OAUTH_CALLBACK_PORT",
                String.valueOf(oauth.getOrDefault("callback-port", oauthDefaults.callbackPort())))),
            String.valueOf(oauth.getOrDefault("callback-path", oauthDefaults.callbackPath())),
            tokenDir != null ? Path.of(String.valueOf(tokenDir)) : oauthDefaults.tokenDir()
        );

        return new CiaConfig(
            reliability,
            (String) raw.get("schema-file"),
            (String) raw.get("schema-inline"),
            oauthSettings,
            parseMcpServers(mcp)
        );
    }

    @SuppressWarnings("unchecked")
    static Map<String, McpServerConfig> parseMcpServers(Map<String, Object> mcp) {
        var servers = new LinkedHashMap<String, McpServerConfig>();
        for (var entry : mcp.entrySet()) {
            var name = entry.getKey();
            if (!(entry.getValue() instanceof Map<?, ?> cfg)) {
                log.warn("MCP server '{}': expected a mapping, skipping", name);
                continue;
            }
            try {
                var server = parseServer(name, (Map<String, Object>) cfg);
                if (!server.isValid()) {
                    log.warn("MCP server '{}': {} server requires {}, skipping", name,
                            server.type().name().toLowerCase(),
                            server.isLocal() ? "'command'" : "an http(s) 'url'");
                    continue;
                }
                servers.put(name, server);
            } catch (RuntimeException e) {
                log.warn("MCP server '{}': invalid configuration: {}", name, e.getMessage());
            }
        }
        return servers;
    }

    @SuppressWarnings("unchecked")
    private static McpServerConfig parseServer(String name, Map<String, Object> cfg) {
        var type = String.valueOf(cfg.getOrDefault("type", cfg.containsKey("url") ? "remote" : "local"));
        var enabled = !Boolean.FALSE.equals(cfg.get("enabled"));
        var timeout = cfg.containsKey("timeout")
                ? Duration.ofMillis(Long.parseLong(String.valueOf(cfg.get("timeout"))))
                : null;

        switch (type) {
            case "local" -> {
                String command = null;
                var args = new ArrayList<String>();
                var rawCommand = cfg.get("command");
                if (rawCommand instanceof List<?> list && !list.isEmpty()) {
                    command = String.valueOf(list.get(0));
                    list.stream().skip(1).map(String::valueOf).forEach(args::add);
                } else if (rawCommand != null) {
                    command = String.valueOf(rawCommand);
                }
                if (cfg.get("args") instanceof List<?> list) {
                    list.stream().map(String::valueOf).forEach(args::add);
                }
                return new McpServerConfig(name, McpServerConfig.Type.LOCAL, command, args,
                        stringMap(cfg.get("environment")), null, null, timeout, enabled, null);
            }
            case "remote" -> {
                return new McpServerConfig(name, McpServerConfig.Type.REMOTE, null, null, null,
                        (String) cfg.get("url"), stringMap(cfg.get("headers")), timeout, enabled,
                        parseOAuth(cfg.get("oauth")));
            }
            default -> throw new IllegalArgumentException("unknown type '" + type + "'");
        }
    }

    private static OAuthClientConfig parseOAuth(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) return null;
        return new OAuthClientConfig(
            map.get("clientId") != null ? String.valueOf(map.get("clientId")) : null,
            map.get("clientSecret") != null ? String.valueOf(map.get("clientSecret")) : null,
            map.get("scope") != null ? String.valueOf(map.get("scope")) : null
        );
    }

    private static Map<String, String> stringMap(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) return Map.of();
        var result = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }

    private static String envOrDefault(Function<String, String> env, String key, String fallback) {
        var val = env.apply(key);
        return val != null ? val : fallback;
    }
}
