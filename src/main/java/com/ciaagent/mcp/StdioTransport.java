package com.ciaagent.mcp;

import com.ciaagent.shared.config.McpServerConfig;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Spawns the server as a subprocess and speaks MCP over its stdin/stdout. */
public class StdioTransport implements TransportStrategy {

    private static final Logger log = LoggerFactory.getLogger(StdioTransport.class);

    @Override
    public String name() { return "stdio"; }

    @Override
    public McpSession open(McpServerConfig server, Map<String, String> headers) {
        var params = ServerParameters.builder(server.command())
                .args(server.args())
                .env(server.environment())
                .build();
        var transport = new StdioClientTransport(params);
        transport.setStdErrorHandler(line -> log.debug("[mcp:{}:stderr] {}", server.name(), line));
        return SdkMcpSession.connect(name(), transport, server.timeout());
    }
}
