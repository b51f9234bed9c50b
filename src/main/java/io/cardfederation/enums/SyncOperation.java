package io.cardfederation.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a single sync call.
 */
public enum SyncOperation {
    PUSH("push"),
    PULL("pull");

    private final String value;

    SyncOperation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
