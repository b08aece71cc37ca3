package com.ciaagent.shared.config;

public record OAuthClientConfig(String clientId, String clientSecret, String scope) {

    public boolean hasClientId() {
        return clientId != null && !clientId.isBlank();
    }
}
