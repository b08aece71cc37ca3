package com.ciaagent.mcp.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * A persisted token record. {@code issuedAt} is stamped locally when the record is
 * stored so that {@code expiresIn} can be checked later.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthTokens(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("scope") String scope,
    @JsonProperty("issued_at") Long issuedAt
) {
    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    public OAuthTokens withIssuedAt(Instant at) {
        return new OAuthTokens(accessToken, refreshToken, expiresIn, tokenType, scope, at.getEpochSecond());
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /** Records without an expiry or issue stamp are treated as valid. */
    public boolean isExpired(Instant now) {
        if (expiresIn == null || issuedAt == null) return false;
        var expiry = Instant.ofEpochSecond(issuedAt).plusSeconds(expiresIn).minus(EXPIRY_SKEW);
        return !now.isBefore(expiry);
    }
}
