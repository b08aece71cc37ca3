package com.ciaagent.mcp.auth;

import com.ciaagent.shared.config.McpServerConfig;
import com.ciaagent.shared.config.OAuthSettings;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for credential handling across servers. Builds a
 * {@link McpOAuthProvider} per OAuth-enabled server over one shared token store.
 */
public class McpAuthService {

    public enum AuthStatus {
        NONE, REQUIRED, VALID;

        public String label() { return name().toLowerCase(); }
    }

    private final OAuthSettings settings;
    private final TokenStore store;
    private final OAuthMetadataDiscovery discovery;
    private final HttpClient httpClient;
    private final BrowserLauncher browser;
    private final Clock clock;

    public McpAuthService(OAuthSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new DesktopBrowserLauncher(), Clock.systemUTC());
    }

    public McpAuthService(OAuthSettings settings, HttpClient httpClient, BrowserLauncher browser, Clock clock) {
        this.settings = settings;
        this.store = new TokenStore(settings.tokenDir());
        this.httpClient = httpClient;
        this.discovery = new OAuthMetadataDiscovery(httpClient, McpOAuthProvider.EXCHANGE_TIMEOUT);
        this.browser = browser;
        this.clock = clock;
    }

    public TokenStore store() { return store; }

    /** @return null when the server is not OAuth-enabled */
    public McpOAuthProvider providerFor(McpServerConfig server) {
        if (!server.requiresAuth()) return null;
        return new McpOAuthProvider(server.name(), server.url(), server.oauth(), settings, store,
                discovery, httpClient, browser, clock);
    }

    /** @return a usable token for the server, or null when none can be obtained */
    public OAuthTokens getValidToken(McpServerConfig server) {
        var provider = providerFor(server);
        return provider != null ? provider.getValidToken() : null;
    }

    public CompletableFuture<OAuthTokens> authorize(McpServerConfig server) {
        var provider = providerFor(server);
        if (provider == null) {
            throw new McpAuthException("Server " + server.name() + " does not have OAuth configured");
        }
        return provider.authorize();
    }

    public boolean logout(String serverName) {
        return store.clear(serverName);
    }

    public boolean hasStoredTokens(String serverName) {
        return store.has(serverName);
    }

    /** Read-only: inspects the stored record without refreshing it. */
    public AuthStatus statusOf(McpServerConfig server) {
        if (!server.requiresAuth()) return AuthStatus.NONE;
        var tokens = store.load(server.name());
        return tokens != null && !tokens.isExpired(clock.instant()) ? AuthStatus.VALID : AuthStatus.REQUIRED;
    }
}
