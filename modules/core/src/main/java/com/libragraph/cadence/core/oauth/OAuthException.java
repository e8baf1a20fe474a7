package com.libragraph.cadence.core.oauth;

public abstract class OAuthException extends RuntimeException {

    protected OAuthException(String message) {
        super(message);
    }

    protected OAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
