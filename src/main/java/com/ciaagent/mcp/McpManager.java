package com.ciaagent.mcp;

import com.ciaagent.mcp.auth.McpAuthService;
import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.providers.ChatChunk;
import com.ciaagent.shared.config.McpServerConfig;
import com.ciaagent.tools.ToolRegistry;
import com.ciaagent.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the MCP server connections and the tool catalog built from them.
 * <p>
 * Sessions, statuses and the catalog change only through the connect, discover and
 * disconnect routines below, each serialized per server. The catalog holds one
 * immutable slice per connected server, and rediscovery swaps a slice in a single
 * put. Accessors return copies.
 * <p>
 * Lifecycle: construct, {@link #start()}, {@link #initialize(Map)}, then
 * {@link #stop()} (or {@link #close()}) when done.
 */
public class McpManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(McpManager.class);

    private final McpConnector connector;
    private final ConnectionMonitor monitor;
    private final MetricsConfig metrics;
    private final ExecutorService executor;

    private volatile Map<String, McpServerConfig> config = Map.of();
    private final Map<String, ServerStatus> status = new ConcurrentHashMap<>();
    private final Map<String, McpSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Map<String, McpTool>> catalog = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private volatile boolean closing;

    public record InitSummary(int connectedServers, int toolCount) {}

    public McpManager(McpConnector connector, ConnectionMonitor monitor, MetricsConfig metrics,
                      ExecutorService executor) {
        this.connector = connector;
        this.monitor = monitor;
        this.metrics = metrics;
        this.executor = executor;
    }

    /** Wires the SDK transports and a daemon worker pool. */
    public static McpManager create(McpAuthService auth, MetricsConfig metrics) {
        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "mcp-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new McpManager(McpConnector.withSdkTransports(auth, executor), new ConnectionMonitor(),
                metrics, executor);
    }

    public void start() {
        monitor.start();
    }

    /** Disconnects everything, then releases the worker pool. */
    public void stop() {
        cleanup();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Connects every enabled server concurrently and waits for all attempts to settle.
     * Disabled servers are recorded without a connection attempt.
     */
    public InitSummary initialize(Map<String, McpServerConfig> servers) {
        closing = false;
        config = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        log.info("Initializing MCP with {} servers", servers.size());

        var attempts = new ArrayList<CompletableFuture<Void>>();
        for (var entry : config.entrySet()) {
            var name = entry.getKey();
            var server = entry.getValue();
            if (!server.enabled()) {
                status.put(name, ServerStatus.disabled());
                log.info("MCP server '{}' is disabled", name);
                continue;
            }
            attempts.add(CompletableFuture.runAsync(() -> connectToServer(name, server), executor)
                    .handle((ignored, error) -> {
                        if (error != null) log.error("Connecting to '{}' failed unexpectedly", name, error);
                        return null;
                    }));
        }
        CompletableFuture.allOf(attempts.toArray(CompletableFuture[]::new)).join();

        var summary = new InitSummary(sessions.size(), getTools().size());
        log.info("Connected to {} servers, {} tools available", summary.connectedServers(), summary.toolCount());
        return summary;
    }

    /** One connection attempt for one server; never throws. */
    public ServerStatus connectToServer(String name, McpServerConfig server) {
        synchronized (lockFor(name)) {
            status.put(name, ServerStatus.connecting());
            log.info("Connecting to MCP server '{}' ({})", name, server.type().name().toLowerCase());
            dropSession(name);

            ConnectionResult result;
            var sample = Timer.start(metrics.registry());
            try {
                result = connector.connect(server);
            } catch (RuntimeException e) {
                result = ConnectionResult.of(ServerStatus.failed(
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            } finally {
                sample.stop(metrics.connectLatency());
            }

            var outcome = result.status();
            var session = result.session();
            if (session != null && closing) {
                log.info("Discarding late session for '{}': manager is shutting down", name);
                closeSession(name, session);
                outcome = ServerStatus.failed("Disconnected");
                status.put(name, outcome);
            } else if (session != null) {
                sessions.put(name, session);
                status.put(name, outcome);
                session.onToolsChanged(() -> onToolsChanged(name, session));
                outcome = ServerStatus.connected(discoverTools(name));
                status.put(name, outcome);
                monitor.updateHealth(name, true, null);
                log.info("Connected to MCP server '{}'", name);
            } else {
                status.put(name, outcome);
                if (outcome.is(ServerStatus.State.FAILED)) {
                    metrics.connectFailures().increment();
                    log.warn("Failed to connect to '{}': {}", name, outcome.error());
                }
                monitor.updateHealth(name, false, outcome.error() != null ? outcome.error() : outcome.toString());
            }
            return outcome;
        }
    }

    /**
     * Lists the server's tools and replaces its catalog slice in one step.
     *
     * @return the number of tools now catalogued for the server
     * @throws IllegalStateException when the server has no live session
     */
    public int discoverTools(String name) {
        synchronized (lockFor(name)) {
            var session = sessions.get(name);
            if (session == null) {
                throw new IllegalStateException("No session for MCP server: " + name);
            }
            List<McpToolDef> defs;
            try {
                defs = session.listTools();
            } catch (IOException e) {
                log.warn("Failed to discover tools from '{}': {}", name, e.getMessage());
                var slice = catalog.get(name);
                return slice != null ? slice.size() : 0;
            }
            var timeout = config.containsKey(name) ? config.get(name).timeout() : McpTool.DEFAULT_TIMEOUT;
            var slice = new LinkedHashMap<String, McpTool>();
            for (var def : defs) {
                var problems = McpTool.validate(def);
                if (!problems.isEmpty()) {
                    log.warn("Skipping tool '{}' from '{}': {}", def.name(), name, String.join("; ", problems));
                    continue;
                }
                var tool = new McpTool(name, def, session, timeout, executor, metrics);
                slice.put(tool.id(), tool);
            }
            catalog.put(name, Collections.unmodifiableMap(slice));
            log.info("Discovered {} tools from '{}'", slice.size(), name);
            return slice.size();
        }
    }

    private void onToolsChanged(String name, McpSession session) {
        try {
            executor.execute(() -> {
                synchronized (lockFor(name)) {
                    if (sessions.get(name) != session) return;
                    log.info("Tools list changed for '{}'", name);
                    int count = discoverTools(name);
                    status.put(name, ServerStatus.connected(count));
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Ignoring tools-changed notification from '{}' after shutdown", name);
        }
    }

    /** Closes the session and drops the server's tools and health record. Idempotent. */
    public void disconnectServer(String name) {
        synchronized (lockFor(name)) {
            boolean wasConnected = dropSession(name);
            monitor.removeServer(name);
            if (wasConnected) {
                status.put(name, ServerStatus.failed("Disconnected"));
                log.info("Disconnected from '{}'", name);
            }
        }
    }

    /** Disconnect then reconnect one server, leaving the others alone. */
    public ServerStatus refreshServer(String name) {
        var server = config.get(name);
        if (server == null) {
            throw new IllegalArgumentException("Unknown MCP server: " + name);
        }
        disconnectServer(name);
        if (!server.enabled()) {
            status.put(name, ServerStatus.disabled());
            return ServerStatus.disabled();
        }
        return connectToServer(name, server);
    }

    /**
     * Disconnects all servers concurrently; one failing close does not hold up the rest.
     * Connects still in flight are waited for and their sessions closed.
     */
    public void cleanup() {
        log.info("Cleaning up MCP connections...");
        closing = true;
        var names = new LinkedHashSet<>(config.keySet());
        names.addAll(sessions.keySet());
        var closes = new ArrayList<CompletableFuture<Void>>();
        for (var name : names) {
            CompletableFuture<Void> close;
            try {
                close = CompletableFuture.runAsync(() -> disconnectServer(name), executor);
            } catch (RejectedExecutionException e) {
                close = CompletableFuture.completedFuture(null);
                disconnectServer(name);
            }
            closes.add(close.handle((ignored, error) -> {
                if (error != null) log.warn("Error disconnecting '{}': {}", name, error.getMessage());
                return null;
            }));
        }
        CompletableFuture.allOf(closes.toArray(CompletableFuture[]::new)).join();
        monitor.stop();
        log.info("MCP cleanup complete");
    }

    private boolean dropSession(String name) {
        catalog.remove(name);
        var session = sessions.remove(name);
        if (session == null) return false;
        closeSession(name, session);
        return true;
    }

    private static void closeSession(String name, McpSession session) {
        session.onToolsChanged(null);
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Error closing session for '{}': {}", name, e.getMessage());
        }
    }

    private Object lockFor(String name) {
        return locks.computeIfAbsent(name, n -> new Object());
    }

    public List<ServerInfo> getStatus() {
        var result = new ArrayList<ServerInfo>();
        for (var name : config.keySet()) {
            result.add(new ServerInfo(name, status.getOrDefault(name, ServerStatus.disabled())));
        }
        return result;
    }

    public ServerStatus getStatus(String name) {
        return config.containsKey(name) ? status.getOrDefault(name, ServerStatus.disabled()) : null;
    }

    public Map<String, McpServerConfig> getConfig() {
        return config;
    }

    public List<McpTool> getTools() {
        var tools = new ArrayList<McpTool>();
        for (var name : config.keySet()) {
            var slice = catalog.get(name);
            if (slice != null) tools.addAll(slice.values());
        }
        return tools;
    }

    public McpTool getTool(String toolId) {
        for (var slice : catalog.values()) {
            var tool = slice.get(toolId);
            if (tool != null) return tool;
        }
        return null;
    }

    /**
     * @throws McpToolException when the id is unknown, the call fails or times out
     */
    public ToolResult executeTool(String toolId, JsonNode args) {
        var tool = getTool(toolId);
        if (tool == null) {
            throw new McpToolException(toolId, "MCP tool not found: " + toolId, null);
        }
        return tool.call(args);
    }

    /** @return how many catalog tools were newly added to the registry */
    public int registerTools(ToolRegistry registry) {
        int added = 0;
        for (var tool : getTools()) {
            if (registry.registerIfAbsent(tool)) {
                added++;
            } else {
                log.warn("Tool name '{}' already registered, skipping MCP tool", tool.name());
            }
        }
        return added;
    }

    public Map<String, HealthRecord> getHealthStatus() {
        return monitor.getAllHealth();
    }

    public boolean isServerHealthy(String name) {
        return monitor.isHealthy(name);
    }

    public List<String> getUnhealthyServers() {
        return monitor.getUnhealthyServers();
    }

    public McpStatusReport getDetailedStatus() {
        var servers = new ArrayList<McpStatusReport.ServerReport>();
        int connected = 0;
        int failed = 0;
        for (var entry : config.entrySet()) {
            var name = entry.getKey();
            var current = status.getOrDefault(name, ServerStatus.disabled());
            if (current.is(ServerStatus.State.CONNECTED)) connected++;
            if (current.is(ServerStatus.State.FAILED)) failed++;
            var slice = catalog.get(name);
            servers.add(new McpStatusReport.ServerReport(name, current, entry.getValue().type(),
                    slice != null ? slice.size() : 0,
                    current.is(ServerStatus.State.FAILED) ? current.error() : null));
        }
        return new McpStatusReport(servers.size(), connected, failed, getTools().size(), servers,
                monitor.getAllHealth());
    }

    /** @param serverName one server, or null for all configured servers */
    public ConnectionDiagnostics getConnectionDiagnostics(String serverName) {
        var names = serverName != null ? List.of(serverName) : new ArrayList<>(config.keySet());
        var result = new ArrayList<ConnectionDiagnostics.ServerDiagnostics>();
        for (var name : names) {
            var server = config.get(name);
            var current = status.getOrDefault(name, ServerStatus.disabled());
            var session = sessions.get(name);
            var health = monitor.getHealth(name);
            result.add(new ConnectionDiagnostics.ServerDiagnostics(
                    name,
                    current.state().label(),
                    session != null ? session.transport()
                            : server != null ? server.type().name().toLowerCase() : "unknown",
                    session != null,
                    session != null,
                    server != null && server.isValid(),
                    current.is(ServerStatus.State.CONNECTED),
                    authenticationStatus(server),
                    health != null ? health.consecutiveFailures() : 0));
        }
        var overall = new ConnectionDiagnostics.Overall(config.size(), sessions.size(),
                monitor.getUnhealthyServers(), monitor.isRunning());
        return new ConnectionDiagnostics(overall, result);
    }

    private String authenticationStatus(McpServerConfig server) {
        if (server == null) return "unknown";
        if (!server.requiresAuth()) return McpAuthService.AuthStatus.NONE.label();
        var auth = connector.auth();
        return auth != null ? auth.statusOf(server).label() : McpAuthService.AuthStatus.REQUIRED.label();
    }

    /** MCP status as a {@code system} chunk for embedding in a chat stream. */
    public ChatChunk getStatusChunk(String sessionId) {
        var servers = getStatus();
        long connected = servers.stream().filter(s -> s.status().is(ServerStatus.State.CONNECTED)).count();
        var toolIds = getTools().stream().map(McpTool::id).toList();
        var content = "MCP: " + connected + "/" + servers.size() + " servers connected, "
                + toolIds.size() + " tools available"
                + (toolIds.isEmpty() ? "" : " (" + String.join(", ", toolIds) + ")");
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("connectedServers", connected);
        metadata.put("totalServers", servers.size());
        metadata.put("toolCount", toolIds.size());
        metadata.put("tools", toolIds);
        return new ChatChunk(ChatChunk.SYSTEM, content, sessionId, null, metadata);
    }
}
