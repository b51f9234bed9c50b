package io.cardfederation.enums;

/**
 * Classification of a failed adapter call. Drives retry decisions of callers.
 */
public enum FailureKind {
    /** The call did not complete within its time budget. */
    TIMEOUT(true),
    /** The remote host could not be reached. */
    CONNECTIVITY(true),
    /** The remote rejected the request (4xx). */
    CLIENT_ERROR(false),
    /** The remote failed while handling the request (5xx). */
    SERVER_ERROR(true),
    /** The remote answered with a body that could not be understood. */
    INVALID_RESPONSE(false),
    /** The caller cancelled the operation. */
    CANCELLED(false),
    /** Anything the adapter did not classify. */
    UNEXPECTED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Classify an HTTP status code that is not a success.
     */
    public static FailureKind fromHttpStatus(int statusCode) {
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode == 408) {
            return TIMEOUT;
        }
        return CLIENT_ERROR;
    }
}
