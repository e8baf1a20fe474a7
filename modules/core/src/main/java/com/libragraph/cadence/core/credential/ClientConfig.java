package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** A tenant's OAuth client registration with one provider. */
public record ClientConfig(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("token_uri") String tokenUri,
        @JsonProperty("redirect_uris") List<String> redirectUris
) {
    public ClientConfig {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(clientSecret, "clientSecret");
        Objects.requireNonNull(tokenUri, "tokenUri");
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
    }

    @Override
    public String toString() {
        return "ClientConfig[clientId=" + clientId + ", tokenUri=" + tokenUri + "]";
    }
}
