package com.ciaagent.mcp;

import com.ciaagent.mcp.auth.McpAuthService;
import com.ciaagent.shared.config.McpServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Opens a session to one server. Local servers use the local strategy; remote servers
 * try each remote strategy in order and keep the first that connects. Every attempt
 * is bounded by the server's timeout. Nothing here throws: the outcome is a
 * {@link ConnectionResult}.
 */
public class McpConnector {

    private static final Logger log = LoggerFactory.getLogger(McpConnector.class);

    /** A 401 in an HTTP status position, or an explicit "unauthorized"; ports and URLs never match. */
    private static final Pattern AUTH_REJECTION = Pattern.compile(
            "(?i)(\\b(status|code)\\W{0,3}|\\bHTTP(/[\\d.]+)?\\s+)401(?!\\d)|(?<!\\d)401\\s+unauthorized|unauthorized");

    private final McpAuthService auth;
    private final TransportStrategy local;
    private final List<TransportStrategy> remote;
    private final ExecutorService executor;

    public McpConnector(McpAuthService auth, TransportStrategy local, List<TransportStrategy> remote,
                        ExecutorService executor) {
        this.auth = auth;
        this.local = local;
        this.remote = List.copyOf(remote);
        this.executor = executor;
    }

    public static McpConnector withSdkTransports(McpAuthService auth, ExecutorService executor) {
        return new McpConnector(auth, new StdioTransport(),
                List.of(new StreamableHttpTransport(), new SseTransport()), executor);
    }

    public McpAuthService auth() { return auth; }

    public ConnectionResult connect(McpServerConfig server) {
        if (!server.enabled()) {
            return ConnectionResult.of(ServerStatus.disabled());
        }
        return server.isLocal() ? connectLocal(server) : connectRemote(server);
    }

    private ConnectionResult connectLocal(McpServerConfig server) {
        try {
            var session = openWithTimeout(local, server, Map.of());
            return connected(server, session);
        } catch (Exception e) {
            var message = messageOf(e);
            log.warn("Local MCP server '{}' ({}) failed to start: {}", server.name(), server.command(), message);
            return ConnectionResult.of(ServerStatus.failed(message));
        }
    }

    private ConnectionResult connectRemote(McpServerConfig server) {
        var headers = new LinkedHashMap<>(server.headers());
        if (server.requiresAuth()) {
            if (!server.oauth().hasClientId()) {
                return ConnectionResult.of(ServerStatus.needsClientRegistration(
                        "OAuth clientId is not configured and dynamic client registration is not supported"));
            }
            var token = auth != null ? tokenFor(server) : null;
            if (token == null) {
                log.info("Authentication required for '{}'. Run: cia mcp auth {}", server.name(), server.name());
                return ConnectionResult.of(ServerStatus.needsAuth());
            }
            headers.put("Authorization", "Bearer " + token);
        }
        logNetworkContext(server.name());

        String lastError = null;
        for (var strategy : remote) {
            try {
                var session = openWithTimeout(strategy, server, headers);
                log.info("Connected to '{}' using {} transport", server.name(), strategy.name());
                return connected(server, session);
            } catch (Exception e) {
                if (isAuthRejection(e)) {
                    log.info("Server '{}' rejected the request as unauthorized ({})", server.name(), strategy.name());
                    return ConnectionResult.of(ServerStatus.needsAuth());
                }
                lastError = messageOf(e);
                log.warn("Transport {} failed for '{}': {}", strategy.name(), server.name(), lastError);
            }
        }
        return ConnectionResult.of(ServerStatus.failed(lastError != null ? lastError : "All transports failed"));
    }

    private String tokenFor(McpServerConfig server) {
        try {
            var tokens = auth.getValidToken(server);
            return tokens != null ? tokens.accessToken() : null;
        } catch (RuntimeException e) {
            log.warn("Token lookup for '{}' failed: {}", server.name(), e.getMessage());
            return null;
        }
    }

    private ConnectionResult connected(McpServerConfig server, McpSession session) {
        return new ConnectionResult(ServerStatus.connected(countTools(server, session)), session);
    }

    /** Tool count for the status line; 0 when the listing fails or times out. */
    int countTools(McpServerConfig server, McpSession session) {
        var future = CompletableFuture.supplyAsync(() -> {
            try {
                return session.listTools().size();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
        try {
            return future.get(server.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Tool count for '{}' unavailable: {}", server.name(), e.getMessage());
            return 0;
        }
    }

    /**
     * Opens a session on the executor and waits at most the server timeout. A session
     * that only opens after the deadline is closed as soon as it arrives.
     */
    McpSession openWithTimeout(TransportStrategy strategy, McpServerConfig server,
                               Map<String, String> headers) throws Exception {
        log.debug("Opening {} session to '{}'", strategy.name(), server.name());
        var future = CompletableFuture.supplyAsync(() -> {
            try {
                return strategy.open(server, headers);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
        try {
            return future.get(server.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.thenAccept(McpSession::close);
            throw new TimeoutException("Connection to '" + server.name() + "' via " + strategy.name()
                    + " timed out after " + server.timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    static boolean isAuthRejection(Throwable error) {
        for (var t = error; t != null; t = t.getCause()) {
            var message = t.getMessage();
            if (message == null) continue;
            if (AUTH_REJECTION.matcher(message).find()) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void logNetworkContext(String serverName) {
        if (!log.isDebugEnabled()) return;
        var proxy = firstNonBlank(System.getenv("HTTPS_PROXY"), System.getenv("HTTP_PROXY"));
        log.debug("Network diagnostics for {}: proxy={}, no_proxy={}, https.proxyHost={}",
                serverName,
                proxy != null ? redactProxy(proxy) : "none",
                firstNonBlank(System.getenv("NO_PROXY"), "none"),
                firstNonBlank(System.getProperty("https.proxyHost"), "unset"));
    }

    static String redactProxy(String proxyUrl) {
        try {
            var uri = URI.create(proxyUrl);
            if (uri.getScheme() == null || uri.getHost() == null) return "[invalid proxy url]";
            if (uri.getRawUserInfo() == null) return uri.toString();
            return new URI(uri.getScheme(), "***:***", uri.getHost(), uri.getPort(),
                    uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
        } catch (Exception e) {
            return "[invalid proxy url]";
        }
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}
