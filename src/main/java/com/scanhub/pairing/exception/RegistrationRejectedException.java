package com.scanhub.pairing.exception;

/**
 * Exception thrown when a connection's register message is refused.
 */
public class RegistrationRejectedException extends RuntimeException {

    public RegistrationRejectedException(String reason) {
        super("Registration rejected: " + reason);
    }

    public RegistrationRejectedException(String reason, Throwable cause) {
        super("Registration rejected: " + reason, cause);
    }
}
