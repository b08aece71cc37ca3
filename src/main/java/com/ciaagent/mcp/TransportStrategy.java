package com.ciaagent.mcp;

import com.ciaagent.shared.config.McpServerConfig;

import java.util.Map;

/**
 * One way of reaching a server. Implementations open and initialize a session or throw.
 */
public interface TransportStrategy {

    String name();

    McpSession open(McpServerConfig server, Map<String, String> headers) throws Exception;
}
