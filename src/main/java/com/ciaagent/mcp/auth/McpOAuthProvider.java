package com.ciaagent.mcp.auth;

import com.ciaagent.shared.config.OAuthClientConfig;
import com.ciaagent.shared.config.OAuthSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * OAuth 2.1 authorization-code flow with PKCE for one remote MCP server.
 * <p>
 * {@link #authorize()} opens a one-shot callback listener on localhost, sends the
 * user to the authorization endpoint and completes once the callback has been
 * handled and the tokens stored. {@link #getValidToken()} never throws: a refresh
 * failure clears the stored record and reports no token.
 */
public class McpOAuthProvider {

    private static final Logger log = LoggerFactory.getLogger(McpOAuthProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Duration EXCHANGE_TIMEOUT = Duration.ofSeconds(30);
    static final Duration AUTHORIZE_WAIT = Duration.ofMinutes(5);

    private final String serverId;
    private final String serverUrl;
    private final OAuthClientConfig client;
    private final OAuthSettings settings;
    private final TokenStore store;
    private final OAuthMetadataDiscovery discovery;
    private final HttpClient httpClient;
    private final BrowserLauncher browser;
    private final Clock clock;
    private volatile OAuthMetadata metadata;

    public McpOAuthProvider(String serverId, String serverUrl, OAuthClientConfig client,
                            OAuthSettings settings, TokenStore store, OAuthMetadataDiscovery discovery,
                            HttpClient httpClient, BrowserLauncher browser, Clock clock) {
        this.serverId = serverId;
        this.serverUrl = serverUrl;
        this.client = client;
        this.settings = settings;
        this.store = store;
        this.discovery = discovery;
        this.httpClient = httpClient;
        this.browser = browser;
        this.clock = clock;
    }

    public String serverId() { return serverId; }

    /** @return a usable token, refreshed when needed, or null */
    public OAuthTokens getValidToken() {
        var tokens = store.load(serverId);
        if (tokens == null) return null;
        if (!tokens.isExpired(clock.instant())) return tokens;
        if (!tokens.hasRefreshToken()) {
            log.info("Stored token for '{}' has expired", serverId);
            return null;
        }
        try {
            return refresh(tokens);
        } catch (RuntimeException e) {
            log.warn("Failed to refresh token for '{}': {}", serverId, e.getMessage());
            store.clear(serverId);
            return null;
        }
    }

    /**
     * Starts the authorization flow. Discovery and listener start-up failures are
     * thrown directly; callback and exchange failures complete the future exceptionally.
     */
    public CompletableFuture<OAuthTokens> authorize() {
        if (client == null || !client.hasClientId()) {
            throw new McpAuthException("OAuth clientId is not configured for " + serverId);
        }
        var meta = metadata();
        var pkce = Pkce.generate();
        var result = new CompletableFuture<OAuthTokens>();

        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", settings.callbackPort()), 0);
        } catch (BindException e) {
            throw new McpAuthException("Port " + settings.callbackPort()
                    + " is already in use. Please ensure no other application is using this port.", e);
        } catch (IOException e) {
            throw new McpAuthException("Failed to start OAuth callback listener: " + e.getMessage(), e);
        }
        var redirectUri = "http://127.0.0.1:" + server.getAddress().getPort() + settings.callbackPath();
        var handlerPool = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "mcp-oauth-callback");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(handlerPool);
        server.createContext(settings.callbackPath(),
                exchange -> handleCallback(exchange, pkce, meta, redirectUri, result));
        server.start();
        log.info("OAuth callback listening on {}", redirectUri);

        result.orTimeout(AUTHORIZE_WAIT.toMillis(), TimeUnit.MILLISECONDS)
                .whenCompleteAsync((tokens, error) -> {
                    server.stop(0);
                    handlerPool.shutdown();
                });

        var authUrl = authorizationUrl(meta, pkce, redirectUri);
        if (!browser.open(authUrl)) {
            log.info("Open this URL to authorize {}: {}", serverId, authUrl);
        }
        return result;
    }

    public void clearTokens() {
        store.clear(serverId);
        log.info("Cleared tokens for '{}'", serverId);
    }

    public boolean hasStoredTokens() {
        return store.has(serverId);
    }

    URI authorizationUrl(OAuthMetadata meta, Pkce pkce, String redirectUri) {
        var params = new LinkedHashMap<String, String>();
        params.put("response_type", "code");
        params.put("client_id", client.clientId());
        params.put("redirect_uri", redirectUri);
        if (client.scope() != null && !client.scope().isBlank()) {
            params.put("scope", client.scope());
        }
        params.put("state", pkce.state());
        params.put("code_challenge", pkce.challenge());
        params.put("code_challenge_method", "S256");
        var endpoint = meta.authorizationEndpoint();
        return URI.create(endpoint + (endpoint.contains("?") ? "&" : "?") + form(params));
    }

    private void handleCallback(HttpExchange exchange, Pkce pkce, OAuthMetadata meta,
                                String redirectUri, CompletableFuture<OAuthTokens> result) throws IOException {
        if (!settings.callbackPath().equals(exchange.getRequestURI().getPath())) {
            respond(exchange, 404, "Not Found");
            return;
        }
        var query = parseQuery(exchange.getRequestURI().getRawQuery());
        try {
            if (query.containsKey("error")) {
                throw new McpAuthException("OAuth error: " + query.get("error"));
            }
            var code = query.get("code");
            var state = query.get("state");
            if (code == null || state == null) {
                throw new McpAuthException("Missing code or state parameter");
            }
            if (!state.equals(pkce.state())) {
                throw new McpAuthException("Invalid state parameter");
            }
            var form = new LinkedHashMap<String, String>();
            form.put("grant_type", "authorization_code");
            form.put("code", code);
            form.put("redirect_uri", redirectUri);
            form.put("code_verifier", pkce.verifier());
            var tokens = requestTokens(meta, form, "exchange code for tokens");
            store.save(serverId, tokens);
            respond(exchange, 200, "<html><body><h2>Authentication Successful</h2>"
                    + "<p>You have authenticated with " + serverId + ". You can close this window.</p></body></html>");
            log.info("Authenticated with '{}'", serverId);
            result.complete(tokens);
        } catch (RuntimeException e) {
            respond(exchange, 400, "<html><body><h2>Authentication Failed</h2><p>"
                    + e.getMessage() + "</p></body></html>");
            log.warn("OAuth callback for '{}' failed: {}", serverId, e.getMessage());
            result.completeExceptionally(e);
        }
    }

    private OAuthTokens refresh(OAuthTokens current) {
        var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.refreshToken());
        var refreshed = requestTokens(metadata(), form, "refresh tokens");
        if (!refreshed.hasRefreshToken()) {
            refreshed = new OAuthTokens(refreshed.accessToken(), current.refreshToken(), refreshed.expiresIn(),
                    refreshed.tokenType(), refreshed.scope(), refreshed.issuedAt());
        }
        store.save(serverId, refreshed);
        log.info("Refreshed token for '{}'", serverId);
        return refreshed;
    }

    private OAuthTokens requestTokens(OAuthMetadata meta, Map<String, String> form, String action) {
        form.put("client_id", client.clientId());
        if (client.clientSecret() != null && !client.clientSecret().isBlank()) {
            form.put("client_secret", client.clientSecret());
        }
        var request = HttpRequest.newBuilder(URI.create(meta.tokenEndpoint()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .timeout(EXCHANGE_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(form(form)))
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new McpAuthException("Failed to " + action + ": HTTP " + response.statusCode()
                        + ": " + response.body());
            }
            var tokens = MAPPER.readValue(response.body(), OAuthTokens.class);
            if (tokens.accessToken() == null) {
                throw new McpAuthException("Failed to " + action + ": response has no access_token");
            }
            if (tokens.tokenType() == null) {
                tokens = new OAuthTokens(tokens.accessToken(), tokens.refreshToken(), tokens.expiresIn(),
                        "Bearer", tokens.scope(), null);
            }
            return tokens.withIssuedAt(clock.instant());
        } catch (IOException e) {
            throw new McpAuthException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpAuthException("Interrupted while trying to " + action, e);
        }
    }

    private OAuthMetadata metadata() {
        var meta = metadata;
        if (meta == null) {
            meta = discovery.discover(serverUrl);
            metadata = meta;
        }
        return meta;
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", status == 404 ? "text/plain" : "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        var params = new LinkedHashMap<String, String>();
        if (rawQuery == null || rawQuery.isEmpty()) return params;
        for (var pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            var key = eq >= 0 ? pair.substring(0, eq) : pair;
            var value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String form(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
