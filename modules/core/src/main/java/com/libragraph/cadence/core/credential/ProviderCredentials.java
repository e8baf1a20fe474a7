package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Client registration plus the current token, if the tenant has authorized. */
public record ProviderCredentials(
        @JsonProperty("config") ClientConfig config,
        @JsonProperty("token") OAuthToken token
) {
    public ProviderCredentials {
        Objects.requireNonNull(config, "config");
    }

    public static ProviderCredentials unauthorized(ClientConfig config) {
        return new ProviderCredentials(config, null);
    }

    public ProviderCredentials withToken(OAuthToken newToken) {
        return new ProviderCredentials(config, newToken);
    }

    public boolean authorized() {
        return token != null;
    }
}
