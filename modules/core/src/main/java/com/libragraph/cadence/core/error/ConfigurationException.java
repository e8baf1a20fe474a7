package com.libragraph.cadence.core.error;

/**
 * Required configuration is absent or unusable: a missing encryption key at
 * startup, or a tenant without an OAuth client configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
