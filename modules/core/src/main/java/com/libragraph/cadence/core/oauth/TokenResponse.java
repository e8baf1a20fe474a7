package com.libragraph.cadence.core.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/** Body of a token endpoint reply; either the token fields or {@code error} is set. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") Long expiresIn,
        @JsonProperty("scope") String scope,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("error") String error,
        @JsonProperty("error_description") String errorDescription
) {
    public static TokenResponse success(String accessToken, String refreshToken, Long expiresIn, String scope) {
        return new TokenResponse(accessToken, refreshToken, expiresIn, scope, "Bearer", null, null);
    }

    public static TokenResponse failure(String error, String description) {
        return new TokenResponse(null, null, null, null, null, error, description);
    }

    public boolean isError() {
        return error != null;
    }

    /** Scopes as granted; providers separate them with spaces or commas. */
    public List<String> scopeList() {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scope.trim().split("[\\s,]+")).toList();
    }

    @Override
    public String toString() {
        return "TokenResponse[expiresIn=" + expiresIn + ", scope=" + scope + ", error=" + error + "]";
    }
}
