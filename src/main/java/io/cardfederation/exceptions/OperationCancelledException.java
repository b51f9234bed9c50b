package io.cardfederation.exceptions;

/**
 * The caller cancelled an operation before it completed.
 */
public class OperationCancelledException extends FederationException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
