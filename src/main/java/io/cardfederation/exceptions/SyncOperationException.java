package io.cardfederation.exceptions;

import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncOperation;
import lombok.Getter;

/**
 * A push or pull failed at the adapter boundary. Sync state is left as it was.
 */
@Getter
public class SyncOperationException extends FederationException {

    private final SyncOperation operation;
    private final PlatformId platform;
    private final FailureKind kind;

    public SyncOperationException(SyncOperation operation, AdapterCallException cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
        this.platform = cause.getPlatform();
        this.kind = cause.getKind();
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
