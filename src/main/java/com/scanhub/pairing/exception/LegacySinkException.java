package com.scanhub.pairing.exception;

/**
 * Exception thrown when the legacy system could not be reached or answered unexpectedly.
 */
public class LegacySinkException extends RuntimeException {

    public LegacySinkException(String message) {
        super(message);
    }

    public LegacySinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
