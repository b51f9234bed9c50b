package io.cardfederation.enums;

/**
 * Lifecycle state of the federation service.
 */
public enum FederationState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
