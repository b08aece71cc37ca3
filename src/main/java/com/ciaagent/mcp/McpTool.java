package com.ciaagent.mcp;

import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.tools.Tool;
import com.ciaagent.tools.ToolContext;
import com.ciaagent.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Adapts one MCP server tool into the agent's {@link Tool} interface.
 * Catalog id is {@code <server>_<tool>}; calls go out under the tool's own name.
 */
public class McpTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(McpTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String serverName;
    private final McpToolDef def;
    private final McpSession session;
    private final Duration timeout;
    private final Executor executor;
    private final MetricsConfig metrics;

    public McpTool(String serverName, McpToolDef def, McpSession session, Duration timeout,
                   Executor executor, MetricsConfig metrics) {
        this.serverName = serverName;
        this.def = def;
        this.session = session;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.executor = executor;
        this.metrics = metrics;
    }

    public String id() { return serverName + "_" + def.name(); }
    public String serverName() { return serverName; }
    public String originalName() { return def.name(); }
    public Duration timeout() { return timeout; }

    @Override public String name() { return id(); }

    @Override
    public String description() {
        var description = def.description();
        return description != null && !description.isBlank()
                ? description
                : "MCP tool " + def.name() + " from " + serverName;
    }

    /** The declared schema laid over an empty, closed object schema. */
    @Override
    public JsonNode inputSchema() {
        var schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        schema.put("additionalProperties", false);
        if (def.inputSchema() instanceof ObjectNode declared) {
            schema.setAll(declared.deepCopy());
        }
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        try {
            return call(input);
        } catch (McpToolException e) {
            return new ToolResult("[ERROR] " + e.getMessage(), true);
        }
    }

    /**
     * Calls the tool, racing the call against the tool timeout. A timed-out call is
     * abandoned, not cancelled on the server.
     *
     * @throws McpToolException on timeout or when the server call fails
     */
    public ToolResult call(JsonNode args) {
        var arguments = args == null || args.isNull() || args.isMissingNode()
                ? MAPPER.createObjectNode()
                : args;
        metrics.toolExecutions().increment();
        log.debug("Executing MCP tool {} with args {}", id(), arguments);

        var future = CompletableFuture.supplyAsync(() -> {
            try {
                return session.callTool(def.name(), arguments);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);

        JsonNode raw;
        try {
            raw = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("MCP tool {} timed out after {}ms", id(), timeout.toMillis());
            throw new McpToolException(id(),
                    "MCP tool " + id() + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            var cause = e.getCause() instanceof CompletionException ce && ce.getCause() != null
                    ? ce.getCause() : e.getCause();
            log.warn("MCP tool {} failed: {}", id(), cause.getMessage());
            throw new McpToolException(id(),
                    "MCP tool execution failed (" + id() + "): " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpToolException(id(), "MCP tool " + id() + " interrupted", e);
        }
        if (raw == null) {
            return new ToolResult("[ERROR] MCP tool returned no result", true);
        }
        return parseResult(raw);
    }

    static ToolResult parseResult(JsonNode result) {
        boolean isError = result.path("isError").asBoolean(false);
        var content = result.get("content");
        if (content == null || !content.isArray() || content.isEmpty()) {
            return new ToolResult("", isError);
        }
        var sb = new StringBuilder();
        for (var item : content) {
            if ("text".equals(item.path("type").asText())) {
                if (sb.length() > 0) sb.append("\n");
                sb.append(item.path("text").asText());
            }
        }
        return new ToolResult(sb.toString(), isError);
    }

    /** @return problems with the descriptor; empty when it can be catalogued */
    public static List<String> validate(McpToolDef def) {
        var errors = new ArrayList<String>();
        var name = def.name();
        if (name == null || name.isBlank()) {
            errors.add("MCP tool name is required and must be a non-empty string");
        } else if (!VALID_NAME.matcher(name).matches()) {
            errors.add("MCP tool name must contain only alphanumeric characters, dashes, and underscores");
        }
        var schema = def.inputSchema();
        if (schema != null && !schema.isNull() && !schema.isObject()) {
            errors.add("MCP tool inputSchema must be an object");
        }
        return errors;
    }

    /** Server part of a catalog id, or null when the id has no separator. */
    public static String extractServerName(String toolId) {
        int idx = toolId.indexOf('_');
        return idx > 0 ? toolId.substring(0, idx) : null;
    }

    public static String extractOriginalToolName(String toolId) {
        int idx = toolId.indexOf('_');
        return idx > 0 ? toolId.substring(idx + 1) : toolId;
    }
}
