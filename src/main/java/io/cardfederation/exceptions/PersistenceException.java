package io.cardfederation.exceptions;

/**
 * Sync state or settings could not be read from or written to the backing store.
 */
public class PersistenceException extends FederationException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
