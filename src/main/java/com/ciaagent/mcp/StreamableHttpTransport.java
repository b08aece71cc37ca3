package com.ciaagent.mcp;

import com.ciaagent.shared.config.McpServerConfig;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;

import java.util.Map;

/** MCP over HTTP request/response streams, the preferred remote transport. */
public class StreamableHttpTransport implements TransportStrategy {

    @Override
    public String name() { return "StreamableHTTP"; }

    @Override
    public McpSession open(McpServerConfig server, Map<String, String> headers) {
        var endpoint = RemoteEndpoint.parse(server.url(), "/mcp");
        var transport = HttpClientStreamableHttpTransport.builder(endpoint.baseUri())
                .endpoint(endpoint.path())
                .customizeRequest(request -> headers.forEach(request::header))
                .build();
        return SdkMcpSession.connect(name(), transport, server.timeout());
    }
}
