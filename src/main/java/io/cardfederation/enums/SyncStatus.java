package io.cardfederation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sync status of a card across its linked platforms.
 */
public enum SyncStatus {
    SYNCED("synced"),
    PENDING("pending"),
    CONFLICT("conflict"),
    ERROR("error");

    private final String value;

    SyncStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SyncStatus fromValue(String value) {
        for (SyncStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sync status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
