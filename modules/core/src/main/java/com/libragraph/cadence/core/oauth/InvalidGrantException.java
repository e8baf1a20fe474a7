package com.libragraph.cadence.core.oauth;

/** The provider rejected the grant; the tenant must re-authorize. */
public class InvalidGrantException extends OAuthException {

    public InvalidGrantException(String message) {
        super(message);
    }

    public InvalidGrantException(String message, Throwable cause) {
        super(message, cause);
    }
}
