package com.ciaagent.mcp;

import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.providers.ChatChunk;
import com.ciaagent.shared.config.McpServerConfig;
import com.ciaagent.shared.config.OAuthClientConfig;
import com.ciaagent.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class McpManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final McpConnector connector = mock(McpConnector.class);
    private final ConnectionMonitor monitor = new ConnectionMonitor();
    private final MetricsConfig metrics = new MetricsConfig();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final McpManager manager = new McpManager(connector, monitor, metrics, executor);

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    private static McpServerConfig local(String name) {
        return McpServerConfig.local(name, "server-" + name, List.of(), Map.of());
    }

    private static McpSession session(String transport, String... tools) throws IOException {
        var session = mock(McpSession.class);
        when(session.transport()).thenReturn(transport);
        var defs = new java.util.ArrayList<McpToolDef>();
        for (var tool : tools) defs.add(new McpToolDef(tool, tool + " tool", null));
        when(session.listTools()).thenReturn(defs);
        return session;
    }

    private void connects(McpServerConfig server, McpSession session) {
        when(connector.connect(server)).thenReturn(
                new ConnectionResult(ServerStatus.connected(0), session));
    }

    @Test
    void initializesMixedOutcomes() throws Exception {
        var good = local("good");
        var bad = local("bad");
        var off = local("off").withEnabled(false);
        connects(good, session("stdio", "read", "write"));
        when(connector.connect(bad)).thenReturn(ConnectionResult.of(ServerStatus.failed("spawn failed")));

        var servers = new LinkedHashMap<String, McpServerConfig>();
        servers.put("good", good);
        servers.put("bad", bad);
        servers.put("off", off);
        var summary = manager.initialize(servers);

        assertEquals(new McpManager.InitSummary(1, 2), summary);
        assertEquals(ServerStatus.State.CONNECTED, manager.getStatus("good").state());
        assertEquals(ServerStatus.failed("spawn failed"), manager.getStatus("bad"));
        assertEquals(ServerStatus.disabled(), manager.getStatus("off"));
        assertNull(manager.getStatus("ghost"));
        verify(connector, never()).connect(off);
        assertEquals(1.0, metrics.connectFailures().count());
        assertEquals(List.of("good", "bad", "off"),
                manager.getStatus().stream().map(ServerInfo::name).toList());
    }

    @Test
    void waitsForSlowConnectionsBeforeReturning() throws Exception {
        var slow = local("slow");
        var session = session("stdio", "ping");
        when(connector.connect(slow)).thenAnswer(inv -> {
            Thread.sleep(200);
            return new ConnectionResult(ServerStatus.connected(1), session);
        });

        var summary = manager.initialize(Map.of("slow", slow));

        assertEquals(1, summary.connectedServers());
        assertNotNull(manager.getTool("slow_ping"));
    }

    @Test
    void sameToolNameOnTwoServersYieldsTwoIds() throws Exception {
        var s1 = local("s1");
        var s2 = local("s2");
        connects(s1, session("stdio", "toolA"));
        connects(s2, session("stdio", "toolA"));

        manager.initialize(new LinkedHashMap<>(Map.of("s1", s1, "s2", s2)));

        assertNotNull(manager.getTool("s1_toolA"));
        assertNotNull(manager.getTool("s2_toolA"));
        assertEquals(2, manager.getTools().size());
    }

    @Test
    void disconnectRemovesOnlyThatServersTools() throws Exception {
        var s1 = local("s1");
        var s10 = local("s10");
        var first = session("stdio", "toolA");
        connects(s1, first);
        connects(s10, session("stdio", "toolA"));
        manager.initialize(new LinkedHashMap<>(Map.of("s1", s1, "s10", s10)));

        manager.disconnectServer("s1");
        manager.disconnectServer("s1");

        assertNull(manager.getTool("s1_toolA"));
        assertNotNull(manager.getTool("s10_toolA"));
        assertEquals(ServerStatus.failed("Disconnected"), manager.getStatus("s1"));
        assertNull(manager.getHealthStatus().get("s1"));
        verify(first, times(1)).close();
    }

    @Test
    void rediscoversToolsOnListChangedNotification() throws Exception {
        var server = local("live");
        var session = session("stdio", "one");
        connects(server, session);
        manager.initialize(Map.of("live", server));
        ArgumentCaptor<Runnable> listener = ArgumentCaptor.forClass(Runnable.class);
        verify(session).onToolsChanged(listener.capture());

        when(session.listTools()).thenReturn(List.of(
                new McpToolDef("one", null, null), new McpToolDef("two", null, null)));
        listener.getValue().run();

        long deadline = System.currentTimeMillis() + 2000;
        while (manager.getTool("live_two") == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertNotNull(manager.getTool("live_two"));
        assertEquals(ServerStatus.connected(2), manager.getStatus("live"));
    }

    @Test
    void refreshReconnectsOneServer() throws Exception {
        var server = local("r");
        var first = session("stdio", "a");
        var second = session("stdio", "a", "b");
        when(connector.connect(server))
                .thenReturn(new ConnectionResult(ServerStatus.connected(1), first))
                .thenReturn(new ConnectionResult(ServerStatus.connected(2), second));
        manager.initialize(Map.of("r", server));

        var status = manager.refreshServer("r");

        assertEquals(ServerStatus.connected(2), status);
        verify(first).close();
        assertNotNull(manager.getTool("r_b"));
        assertThrows(IllegalArgumentException.class, () -> manager.refreshServer("nope"));
    }

    @Test
    void unknownToolIdIsAnError() {
        var e = assertThrows(McpToolException.class,
                () -> manager.executeTool("ghost_tool", MAPPER.createObjectNode()));
        assertEquals("MCP tool not found: ghost_tool", e.getMessage());
    }

    @Test
    void executeToolCallsServerUnderOriginalName() throws Exception {
        var server = local("fs");
        var session = session("stdio", "read_file");
        when(session.callTool(eq("read_file"), any())).thenReturn(MAPPER.readTree(
                "{\"content\":[{\"type\":\"text\",\"text\":\"hello\"}]}"));
        connects(server, session);
        manager.initialize(Map.of("fs", server));

        var result = manager.executeTool("fs_read_file", MAPPER.readTree("{\"path\":\"a.txt\"}"));

        assertEquals("hello", result.output());
        assertFalse(result.isError());
    }

    @Test
    void cleanupToleratesFailingClose() throws Exception {
        var a = local("a");
        var b = local("b");
        var broken = session("stdio", "x");
        doThrow(new RuntimeException("pipe closed")).when(broken).close();
        var fine = session("stdio", "y");
        connects(a, broken);
        connects(b, fine);
        manager.start();
        manager.initialize(new LinkedHashMap<>(Map.of("a", a, "b", b)));

        manager.cleanup();

        verify(fine).close();
        assertTrue(manager.getTools().isEmpty());
        assertFalse(monitor.isRunning());
    }

    @Test
    void tracksHealthPerServer() throws Exception {
        var up = local("up");
        var down = local("down");
        connects(up, session("stdio"));
        when(connector.connect(down)).thenReturn(ConnectionResult.of(ServerStatus.failed("refused")));

        manager.initialize(new LinkedHashMap<>(Map.of("up", up, "down", down)));

        assertTrue(manager.isServerHealthy("up"));
        assertFalse(manager.isServerHealthy("down"));
        assertEquals(List.of("down"), manager.getUnhealthyServers());
        assertEquals("refused", manager.getHealthStatus().get("down").lastError());
    }

    @Test
    void detailedStatusCountsServersAndTools() throws Exception {
        var up = local("up");
        var down = local("down");
        connects(up, session("stdio", "a", "b"));
        when(connector.connect(down)).thenReturn(ConnectionResult.of(ServerStatus.failed("refused")));
        manager.initialize(new LinkedHashMap<>(Map.of("up", up, "down", down)));

        var report = manager.getDetailedStatus();

        assertEquals(2, report.serverCount());
        assertEquals(1, report.connectedServers());
        assertEquals(1, report.failedServers());
        assertEquals(2, report.toolCount());
        var downReport = report.servers().stream().filter(s -> s.name().equals("down")).findFirst().orElseThrow();
        assertEquals("refused", downReport.lastError());
    }

    @Test
    void diagnosticsDescribeTransportAndAuth() throws Exception {
        var files = local("files");
        var api = McpServerConfig.remote("api", "https://api.example.com/mcp", Map.of(),
                new OAuthClientConfig("client", null, null));
        connects(files, session("stdio", "a"));
        when(connector.connect(api)).thenReturn(ConnectionResult.of(ServerStatus.needsAuth()));
        manager.initialize(new LinkedHashMap<>(Map.of("files", files, "api", api)));

        var all = manager.getConnectionDiagnostics(null);
        assertEquals(2, all.overall().totalServers());
        assertEquals(1, all.overall().healthyConnections());

        var filesDiag = manager.getConnectionDiagnostics("files").servers().get(0);
        assertEquals("connected", filesDiag.status());
        assertEquals("stdio", filesDiag.transportType());
        assertTrue(filesDiag.clientConnected());
        assertEquals("none", filesDiag.authenticationStatus());

        var apiDiag = manager.getConnectionDiagnostics("api").servers().get(0);
        assertEquals("needs_auth", apiDiag.status());
        assertEquals("remote", apiDiag.transportType());
        assertEquals("required", apiDiag.authenticationStatus());
        assertEquals(1, apiDiag.consecutiveFailures());

        var ghost = manager.getConnectionDiagnostics("ghost").servers().get(0);
        assertEquals("unknown", ghost.authenticationStatus());
        assertFalse(ghost.configValid());
    }

    @Test
    void statusChunkSummarizesCatalog() throws Exception {
        var server = local("fs");
        connects(server, session("stdio", "read"));
        manager.initialize(Map.of("fs", server));

        var chunk = manager.getStatusChunk("session-1");

        assertEquals(ChatChunk.SYSTEM, chunk.type());
        assertEquals("session-1", chunk.sessionId());
        assertEquals("MCP: 1/1 servers connected, 1 tools available (fs_read)", chunk.content());
        assertEquals(List.of("fs_read"), chunk.metadata().get("tools"));
    }

    @Test
    void registersToolsWithoutOverwriting() throws Exception {
        var server = local("fs");
        connects(server, session("stdio", "read", "write"));
        manager.initialize(Map.of("fs", server));
        var registry = new ToolRegistry();
        var existing = manager.getTool("fs_read");
        registry.register(existing);

        assertEquals(1, manager.registerTools(registry));
        assertSame(existing, registry.get("fs_read"));
        assertNotNull(registry.get("fs_write"));
    }

    @Test
    void skipsToolsWithInvalidNames() throws Exception {
        var server = local("fs");
        connects(server, session("stdio", "good", "bad name", ""));

        manager.initialize(Map.of("fs", server));

        assertEquals(List.of("fs_good"), manager.getTools().stream().map(McpTool::id).toList());
    }

    @Test
    void statusCountsOnlyCataloguedTools() throws Exception {
        var server = local("fs");
        var session = session("stdio", "good", "bad name");
        when(connector.connect(server)).thenReturn(new ConnectionResult(ServerStatus.connected(2), session));

        manager.initialize(Map.of("fs", server));

        assertEquals(ServerStatus.connected(1), manager.getStatus("fs"));
        assertEquals(1, manager.getTools().size());
    }

    @Test
    void cleanupClosesSessionOfConnectInFlight() throws Exception {
        var server = local("slow");
        var session = session("stdio", "ping");
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        when(connector.connect(server)).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new ConnectionResult(ServerStatus.connected(1), session);
        });

        var init = CompletableFuture.runAsync(() -> manager.initialize(Map.of("slow", server)));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        var cleanup = CompletableFuture.runAsync(manager::cleanup);
        Thread.sleep(100);
        release.countDown();
        init.get(5, TimeUnit.SECONDS);
        cleanup.get(5, TimeUnit.SECONDS);

        verify(session).close();
        assertNotEquals(ServerStatus.State.CONNECTED, manager.getStatus("slow").state());
        assertTrue(manager.getTools().isEmpty());
    }

    @Test
    void discoverWithoutSessionFails() {
        assertThrows(IllegalStateException.class, () -> manager.discoverTools("nobody"));
    }
}
