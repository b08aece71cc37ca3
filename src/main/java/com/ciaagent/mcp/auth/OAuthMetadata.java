package com.ciaagent.mcp.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The subset of RFC 8414 authorization server metadata the PKCE flow needs. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthMetadata(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint
) {
    public boolean isComplete() {
        return authorizationEndpoint != null && !authorizationEndpoint.isBlank()
                && tokenEndpoint != null && !tokenEndpoint.isBlank();
    }
}
