package com.scanhub.pairing.exception;

/**
 * Exception thrown when a pairing could not be committed to the store.
 * Nothing of the failed commit is visible afterwards.
 */
public class PairingCommitException extends RuntimeException {

    public PairingCommitException(Long product, Throwable cause) {
        super("Pairing commit failed for product " + product, cause);
    }
}
