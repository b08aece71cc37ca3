package com.ciaagent.mcp;

import com.ciaagent.shared.config.McpServerConfig;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;

import java.util.Map;

/** MCP over an HTTP server-sent event stream, the fallback for older remote servers. */
public class SseTransport implements TransportStrategy {

    @Override
    public String name() { return "SSE"; }

    @Override
    public McpSession open(McpServerConfig server, Map<String, String> headers) {
        var endpoint = RemoteEndpoint.parse(server.url(), "/sse");
        var transport = HttpClientSseClientTransport.builder(endpoint.baseUri())
                .sseEndpoint(endpoint.path())
                .customizeRequest(request -> headers.forEach(request::header))
                .build();
        return SdkMcpSession.connect(name(), transport, server.timeout());
    }
}
