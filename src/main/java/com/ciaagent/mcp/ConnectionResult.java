package com.ciaagent.mcp;

/** Outcome of one connection attempt; {@code session} is non-null only when connected. */
public record ConnectionResult(ServerStatus status, McpSession session) {

    public static ConnectionResult of(ServerStatus status) {
        return new ConnectionResult(status, null);
    }
}
