package com.ciaagent.shared.config;

import java.nio.file.Path;

public record OAuthSettings(int callbackPort, String callbackPath, Path tokenDir) {

    public static OAuthSettings defaults() {
        return new OAuthSettings(19876, "/mcp/oauth/callback",
                Path.of(System.getProperty("user.home"), ".cia", "mcp-tokens"));
    }

    public String redirectUrl() {
        return "http://127.0.0.1:" + callbackPort + callbackPath;
    }
}
