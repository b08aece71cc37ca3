package com.ciaagent.shared.config;

import java.util.Map;

public record CiaConfig(
    ReliabilityConfig reliability,
    String schemaFile,
    String schemaInline,
    OAuthSettings oauth,
    Map<String, McpServerConfig> mcpServers
) {}
