package com.libragraph.cadence.core.oauth;

/** The token endpoint could not be reached or answered unusably. Transient. */
public class TokenExchangeException extends OAuthException {

    public TokenExchangeException(String message) {
        super(message);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
