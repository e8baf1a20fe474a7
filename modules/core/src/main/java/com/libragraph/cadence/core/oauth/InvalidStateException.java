package com.libragraph.cadence.core.oauth;

/** The authorization state is missing, expired, or does not match; restart authorization. */
public class InvalidStateException extends OAuthException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
