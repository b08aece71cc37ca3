package com.ciaagent.mcp;

import java.util.List;

public record ConnectionDiagnostics(Overall overall, List<ServerDiagnostics> servers) {

    public record Overall(
        int totalServers,
        int healthyConnections,
        List<String> unhealthyServers,
        boolean monitoringActive
    ) {}

    /**
     * {@code authenticationStatus} is one of {@code none}, {@code required},
     * {@code valid} or {@code unknown} (server not configured).
     */
    public record ServerDiagnostics(
        String name,
        String status,
        String transportType,
        boolean transportActive,
        boolean clientConnected,
        boolean configValid,
        boolean transportReachable,
        String authenticationStatus,
        int consecutiveFailures
    ) {}
}
