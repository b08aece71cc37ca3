package com.ciaagent.shared.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One configured MCP server. Local servers are spawned as subprocesses;
 * remote servers are reached over HTTP. Immutable for one orchestration cycle.
 */
public record McpServerConfig(
    String name,
    Type type,
    String command,
    List<String> args,
    Map<String, String> environment,
    String url,
    Map<String, String> headers,
    Duration timeout,
    boolean enabled,
    OAuthClientConfig oauth
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public enum Type { LOCAL, REMOTE }

    public McpServerConfig {
        args = args != null ? List.copyOf(args) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public static McpServerConfig local(String name, String command, List<String> args,
                                        Map<String, String> environment) {
        return new McpServerConfig(name, Type.LOCAL, command, args, environment,
                null, null, null, true, null);
    }

    public static McpServerConfig remote(String name, String url, Map<String, String> headers,
                                         OAuthClientConfig oauth) {
        return new McpServerConfig(name, Type.REMOTE, null, null, null,
                url, headers, null, true, oauth);
    }

    public McpServerConfig withTimeout(Duration value) {
        return new McpServerConfig(name, type, command, args, environment, url, headers, value, enabled, oauth);
    }

    public McpServerConfig withEnabled(boolean value) {
        return new McpServerConfig(name, type, command, args, environment, url, headers, timeout, value, oauth);
    }

    public boolean isLocal() { return type == Type.LOCAL; }

    public boolean requiresAuth() { return type == Type.REMOTE && oauth != null; }

    /** Local servers need a command, remote servers an http(s) URL. */
    public boolean isValid() {
        if (type == Type.LOCAL) return command != null && !command.isBlank();
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }
}
