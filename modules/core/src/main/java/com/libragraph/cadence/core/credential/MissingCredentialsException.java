package com.libragraph.cadence.core.credential;

import com.libragraph.cadence.core.error.ConfigurationException;

/** The tenant has not uploaded a client configuration for the provider. */
public class MissingCredentialsException extends ConfigurationException {

    private final Provider provider;

    public MissingCredentialsException(int tenantId, Provider provider) {
        super("No " + provider.key() + " client configuration for tenant " + tenantId
                + "; upload credentials first");
        this.provider = provider;
    }

    public Provider provider() {
        return provider;
    }
}
