package com.ciaagent.observability;

import com.ciaagent.mcp.McpManager;
import com.ciaagent.mcp.ServerStatus;

import java.util.ArrayList;
import java.util.List;

public class DoctorCommand {

    private final McpManager manager;

    public DoctorCommand(McpManager manager) {
        this.manager = manager;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.addAll(checkServers());
        results.add(checkMonitoring());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private List<String> checkServers() {
        var diagnostics = manager.getConnectionDiagnostics(null);
        if (diagnostics.servers().isEmpty()) {
            return List.of("[WARN] No MCP servers configured");
        }
        var lines = new ArrayList<String>();
        for (var server : diagnostics.servers()) {
            var status = manager.getStatus(server.name());
            var name = "MCP server '" + server.name() + "'";
            if (!server.configValid()) {
                lines.add("[FAIL] " + name + ": invalid configuration");
            } else if (status == null || status.is(ServerStatus.State.DISABLED)) {
                lines.add("[SKIP] " + name + " is disabled");
            } else if (status.is(ServerStatus.State.CONNECTED)) {
                lines.add("[OK] " + name + " connected via " + server.transportType()
                        + " (" + status.toolCount() + " tools)");
            } else if (status.is(ServerStatus.State.NEEDS_AUTH)) {
                lines.add("[WARN] " + name + " needs authentication (run: cia mcp auth " + server.name() + ")");
            } else if (status.is(ServerStatus.State.NEEDS_CLIENT_REGISTRATION)) {
                lines.add("[WARN] " + name + " needs client registration: " + status.error());
            } else {
                lines.add("[FAIL] " + name + ": " + status
                        + " (consecutive failures: " + server.consecutiveFailures() + ")");
            }
        }
        return lines;
    }

    private String checkMonitoring() {
        var unhealthy = manager.getUnhealthyServers();
        return unhealthy.isEmpty()
                ? "[OK] No unhealthy MCP connections"
                : "[WARN] Unhealthy MCP connections: " + String.join(", ", unhealthy);
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
