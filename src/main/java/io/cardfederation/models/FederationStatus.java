package io.cardfederation.models;

import io.cardfederation.enums.FederationState;
import io.cardfederation.enums.PlatformId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Point-in-time view of the federation service for status displays.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FederationStatus {
    private FederationState state;
    private boolean syncing;
    private SyncResult lastSyncResult;
    private String error;
    private List<PlatformId> registeredPlatforms;
    private List<CardSyncState> syncStates;
}
