package com.ciaagent.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link McpSession} over the MCP Java SDK's synchronous client.
 */
public class SdkMcpSession implements McpSession {

    private static final Logger log = LoggerFactory.getLogger(SdkMcpSession.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String transport;
    private final McpSyncClient client;
    private final AtomicReference<Runnable> toolsChanged;

    private SdkMcpSession(String transport, McpSyncClient client, AtomicReference<Runnable> toolsChanged) {
        this.transport = transport;
        this.client = client;
        this.toolsChanged = toolsChanged;
    }

    /**
     * Builds a client over {@code clientTransport} and runs the initialize handshake.
     * The client is closed again when the handshake fails.
     */
    public static SdkMcpSession connect(String transportName, McpClientTransport clientTransport,
                                        Duration requestTimeout) {
        var listener = new AtomicReference<Runnable>();
        McpSyncClient client = McpClient.sync(clientTransport)
                .requestTimeout(requestTimeout)
                .toolsChangeConsumer(tools -> {
                    var handler = listener.get();
                    if (handler != null) handler.run();
                })
                .build();
        try {
            client.initialize();
        } catch (RuntimeException e) {
            closeQuietly(client);
            throw e;
        }
        return new SdkMcpSession(transportName, client, listener);
    }

    @Override
    public String transport() { return transport; }

    @Override
    public List<McpToolDef> listTools() throws IOException {
        var defs = new ArrayList<McpToolDef>();
        try {
            String cursor = null;
            do {
                var page = cursor == null ? client.listTools() : client.listTools(cursor);
                if (page.tools() != null) {
                    for (var tool : page.tools()) {
                        defs.add(new McpToolDef(tool.name(), tool.description(), schemaOf(tool)));
                    }
                }
                cursor = page.nextCursor();
            } while (cursor != null && !cursor.isBlank());
        } catch (RuntimeException e) {
            throw new IOException("tools/list failed: " + e.getMessage(), e);
        }
        return defs;
    }

    @Override
    @SuppressWarnings("unchecked")
    public JsonNode callTool(String toolName, JsonNode arguments) throws IOException {
        Map<String, Object> args = arguments != null && arguments.isObject()
                ? MAPPER.convertValue(arguments, Map.class)
                : Map.of();
        try {
            var result = client.callTool(new McpSchema.CallToolRequest(toolName, args));
            return MAPPER.valueToTree(result);
        } catch (RuntimeException e) {
            throw new IOException("tools/call '" + toolName + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void onToolsChanged(Runnable listener) {
        toolsChanged.set(listener);
    }

    @Override
    public void close() {
        toolsChanged.set(null);
        closeQuietly(client);
    }

    private static JsonNode schemaOf(McpSchema.Tool tool) {
        if (tool.inputSchema() == null) return null;
        JsonNode node = MAPPER.valueToTree(tool.inputSchema());
        if (node instanceof ObjectNode object) {
            var nulls = new ArrayList<String>();
            object.fields().forEachRemaining(e -> {
                if (e.getValue().isNull()) nulls.add(e.getKey());
            });
            object.remove(nulls);
        }
        return node;
    }

    private static void closeQuietly(McpSyncClient client) {
        try {
            if (!client.closeGracefully()) {
                client.close();
            }
        } catch (RuntimeException e) {
            log.debug("MCP client close failed: {}", e.getMessage());
            client.close();
        }
    }
}
