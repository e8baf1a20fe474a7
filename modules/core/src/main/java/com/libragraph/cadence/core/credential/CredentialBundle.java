package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The decrypted content of a tenant's credential record: one entry per provider the
 * tenant has configured. Immutable; updates return a new bundle.
 */
public record CredentialBundle(
        @JsonProperty("providers") Map<Provider, ProviderCredentials> providers
) {
    public CredentialBundle {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public static CredentialBundle empty() {
        return new CredentialBundle(Map.of());
    }

    public Optional<ProviderCredentials> find(Provider provider) {
        return Optional.ofNullable(providers.get(provider));
    }

    public CredentialBundle with(Provider provider, ProviderCredentials credentials) {
        Map<Provider, ProviderCredentials> copy = new EnumMap<>(Provider.class);
        copy.putAll(providers);
        copy.put(provider, credentials);
        return new CredentialBundle(copy);
    }
}
