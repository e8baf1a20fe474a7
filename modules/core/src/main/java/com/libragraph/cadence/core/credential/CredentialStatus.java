package com.libragraph.cadence.core.credential;

import java.time.Instant;

/** What a tenant has set up with one provider. Never carries secrets. */
public record CredentialStatus(
        Provider provider,
        boolean configured,
        boolean authorized,
        Instant tokenExpiry
) {
    static CredentialStatus of(Provider provider, ProviderCredentials credentials) {
        if (credentials == null) {
            return new CredentialStatus(provider, false, false, null);
        }
        Instant expiry = credentials.token() == null ? null : credentials.token().expiry();
        return new CredentialStatus(provider, true, credentials.authorized(), expiry);
    }
}
