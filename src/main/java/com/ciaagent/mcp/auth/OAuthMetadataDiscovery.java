package com.ciaagent.mcp.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up {@code /.well-known/oauth-authorization-server} for a server URL,
 * trying the path-aware location before the root one.
 */
public class OAuthMetadataDiscovery {

    private static final Logger log = LoggerFactory.getLogger(OAuthMetadataDiscovery.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String WELL_KNOWN = "/.well-known/oauth-authorization-server";

    private final HttpClient httpClient;
    private final Duration timeout;

    public OAuthMetadataDiscovery(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    public OAuthMetadata discover(String serverUrl) {
        Exception lastError = null;
        for (var candidate : candidates(serverUrl)) {
            try {
                var request = HttpRequest.newBuilder(candidate)
                        .header("Accept", "application/json")
                        .timeout(timeout)
                        .GET()
                        .build();
                var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() == 200) {
                    var metadata = MAPPER.readValue(response.body(), OAuthMetadata.class);
                    if (metadata.isComplete()) {
                        log.debug("Discovered OAuth metadata at {}", candidate);
                        return metadata;
                    }
                }
                log.debug("No usable OAuth metadata at {} (HTTP {})", candidate, response.statusCode());
            } catch (IOException e) {
                lastError = e;
                log.debug("OAuth metadata lookup at {} failed: {}", candidate, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new McpAuthException("OAuth metadata discovery interrupted", e);
            }
        }
        throw new McpAuthException("OAuth metadata discovery failed for " + serverUrl, lastError);
    }

    static List<URI> candidates(String serverUrl) {
        var uri = URI.create(serverUrl);
        var origin = uri.getScheme() + "://" + uri.getRawAuthority();
        var path = uri.getRawPath();
        var result = new ArrayList<URI>();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            result.add(URI.create(origin + WELL_KNOWN + path.replaceAll("/+$", "")));
        }
        result.add(URI.create(origin + WELL_KNOWN));
        return result;
    }
}
