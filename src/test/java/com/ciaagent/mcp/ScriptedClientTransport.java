package com.ciaagent.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * In-process MCP server behind the SDK client transport interface. Serves two pages of
 * tools, echoes {@code tools/call} arguments and can push a tools-changed notification.
 */
class ScriptedClientTransport implements McpClientTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    final List<String> methods = new CopyOnWriteArrayList<>();
    volatile List<String> secondPage = List.of("write");
    volatile boolean closed;

    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        var t = new Thread(r, "scripted-mcp-server");
        t.setDaemon(true);
        return t;
    });
    private volatile Function<Mono<McpSchema.JSONRPCMessage>, Mono<McpSchema.JSONRPCMessage>> handler;

    @Override
    public Mono<Void> connect(Function<Mono<McpSchema.JSONRPCMessage>, Mono<McpSchema.JSONRPCMessage>> handler) {
        this.handler = handler;
        return Mono.empty();
    }

    @Override
    public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
        if (message instanceof McpSchema.JSONRPCRequest request) {
            methods.add(request.method());
            var result = respond(request.method(), MAPPER.valueToTree(request.params()));
            deliver(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), result, null));
        }
        return Mono.empty();
    }

    void pushToolsChanged() {
        deliver(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
                McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null));
    }

    private void deliver(McpSchema.JSONRPCMessage message) {
        delivery.execute(() -> handler.apply(Mono.just(message)).subscribe());
    }

    private JsonNode respond(String method, JsonNode params) {
        var result = MAPPER.createObjectNode();
        switch (method) {
            case McpSchema.METHOD_INITIALIZE -> {
                result.put("protocolVersion", params.path("protocolVersion").asText());
                result.putObject("capabilities").putObject("tools").put("listChanged", true);
                result.putObject("serverInfo").put("name", "scripted").put("version", "1.0.0");
            }
            case McpSchema.METHOD_TOOLS_LIST -> {
                var cursor = params.path("cursor").asText(null);
                var tools = result.putArray("tools");
                if (cursor == null) {
                    tool(tools.addObject(), "read");
                    result.put("nextCursor", "page-2");
                } else {
                    secondPage.forEach(name -> tool(tools.addObject(), name));
                }
            }
            case McpSchema.METHOD_TOOLS_CALL -> {
                var text = params.path("arguments").path("text").asText();
                result.putArray("content").addObject().put("type", "text").put("text", "echo: " + text);
                result.put("isError", false);
            }
            default -> { }
        }
        return result;
    }

    private static void tool(ObjectNode node, String name) {
        node.put("name", name);
        node.put("description", name + " a file");
        var schema = node.putObject("inputSchema");
        schema.put("type", "object");
        schema.putObject("properties").putObject("path").put("type", "string");
    }

    @Override
    public Mono<Void> closeGracefully() {
        closed = true;
        delivery.shutdown();
        return Mono.empty();
    }

    @Override
    public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
        return MAPPER.convertValue(data, typeRef);
    }
}
