package com.ciaagent.mcp;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A live, initialized connection to one MCP server. Owned by {@link McpManager}
 * until it is closed; never shared between servers.
 */
public interface McpSession extends Closeable {

    /** Name of the transport the session was opened over. */
    String transport();

    List<McpToolDef> listTools() throws IOException;

    /** @return the raw {@code tools/call} result: {@code {content: [...], isError?}} */
    JsonNode callTool(String toolName, JsonNode arguments) throws IOException;

    /** Registers the handler for server-pushed "tool list changed" notifications. */
    void onToolsChanged(Runnable listener);

    @Override
    void close();
}
