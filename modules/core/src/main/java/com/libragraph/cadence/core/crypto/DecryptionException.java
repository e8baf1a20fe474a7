package com.libragraph.cadence.core.crypto;

/**
 * A sealed credential blob could not be opened: it was tampered with, truncated,
 * or sealed under a different key. Never recovered from by substituting empty data.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
