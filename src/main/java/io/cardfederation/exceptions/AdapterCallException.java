package io.cardfederation.exceptions;

import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import lombok.Getter;

/**
 * A call across a platform adapter boundary failed.
 */
@Getter
public class AdapterCallException extends FederationException {

    private final PlatformId platform;
    private final FailureKind kind;
    private final int statusCode;

    public AdapterCallException(PlatformId platform, FailureKind kind, String message) {
        this(platform, kind, 0, message, null);
    }

    public AdapterCallException(PlatformId platform, FailureKind kind, String message, Throwable cause) {
        this(platform, kind, 0, message, cause);
    }

    public AdapterCallException(PlatformId platform, FailureKind kind, int statusCode, String message, Throwable cause) {
        super("[" + platform + "] " + message, cause);
        this.platform = platform;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
