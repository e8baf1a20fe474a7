package com.libragraph.cadence.core.oauth;

/** No usable token remains and none can be refreshed; the tenant must re-authorize. */
public class ExpiredCredentialsException extends OAuthException {

    public ExpiredCredentialsException(String message) {
        super(message);
    }

    public ExpiredCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
