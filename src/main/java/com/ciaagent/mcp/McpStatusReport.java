package com.ciaagent.mcp;

import com.ciaagent.shared.config.McpServerConfig;

import java.util.List;
import java.util.Map;

/** Point-in-time summary of every configured server. */
public record McpStatusReport(
    int serverCount,
    int connectedServers,
    int failedServers,
    int toolCount,
    List<ServerReport> servers,
    Map<String, HealthRecord> health
) {
    public record ServerReport(
        String name,
        ServerStatus status,
        McpServerConfig.Type type,
        int toolCount,
        String lastError
    ) {}
}
