package com.libragraph.cadence.core.support;

import com.libragraph.cadence.core.crypto.CredentialVault;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

public final class TestKeys {

    private TestKeys() {
    }

    public static String randomKey() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    public static CredentialVault vault() {
        return new CredentialVault(Optional.of(randomKey()), TestMappers.objectMapper());
    }
}
