package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.cardfederation.config.Constants.FEDERATED_CARDS_SEGMENT;

/**
 * Durable record mapping one local card to its identifiers on every platform it is linked to.
 *
 * <p>{@code platformIds}, {@code lastSync} and {@code platformVersionHashes} are parallel:
 * unlinking a platform removes its entry from all three. A record without platform links
 * must not be persisted.
 */
@Data
@NoArgsConstructor
public class CardSyncState {

    @JsonProperty("localId")
    private String localId;

    @JsonProperty("federatedId")
    private String federatedId;

    @JsonProperty("platformIds")
    private Map<PlatformId, String> platformIds = new LinkedHashMap<>();

    @JsonProperty("lastSync")
    private Map<PlatformId, Instant> lastSync = new LinkedHashMap<>();

    @JsonProperty("platformVersionHashes")
    private Map<PlatformId, String> platformVersionHashes = new LinkedHashMap<>();

    @JsonProperty("versionHash")
    private String versionHash = "";

    @JsonProperty("status")
    private SyncStatus status = SyncStatus.SYNCED;

    /**
     * New record for a local card; the federated id is derived once and never changes.
     */
    public static CardSyncState create(String originUrl, String localId) {
        CardSyncState state = new CardSyncState();
        state.setLocalId(localId);
        state.setFederatedId(federatedIdFor(originUrl, localId));
        return state;
    }

    public static String federatedIdFor(String originUrl, String localId) {
        return originUrl + FEDERATED_CARDS_SEGMENT + localId;
    }

    /**
     * Link a platform without a pushed content hash (reconciliation and manual bookkeeping).
     * A previously recorded hash survives only when the remote id is unchanged.
     */
    public void linkPlatform(PlatformId platform, String remoteId, Instant syncedAt) {
        String previous = platformIds.get(platform);
        if (previous != null && !previous.equals(remoteId)) {
            platformVersionHashes.remove(platform);
        }
        platformIds.put(platform, remoteId);
        lastSync.put(platform, syncedAt);
    }

    /**
     * Link a platform after content with the given hash was written to it.
     */
    public void linkPlatform(PlatformId platform, String remoteId, Instant syncedAt, String contentHash) {
        platformIds.put(platform, remoteId);
        lastSync.put(platform, syncedAt);
        if (contentHash != null) {
            platformVersionHashes.put(platform, contentHash);
        } else {
            platformVersionHashes.remove(platform);
        }
    }

    /**
     * Remove every entry for the platform.
     *
     * @return true if the platform was linked
     */
    public boolean unlinkPlatform(PlatformId platform) {
        boolean removed = platformIds.remove(platform) != null;
        lastSync.remove(platform);
        platformVersionHashes.remove(platform);
        return removed;
    }

    public boolean isLinkedTo(PlatformId platform) {
        return platformIds.containsKey(platform);
    }

    public String remoteIdOn(PlatformId platform) {
        return platformIds.get(platform);
    }

    public boolean hasPlatformLinks() {
        return !platformIds.isEmpty();
    }

    /**
     * True when content with this hash was already pushed to the platform and the link is healthy.
     */
    public boolean isUpToDateOn(PlatformId platform, String contentHash) {
        return isLinkedTo(platform)
                && status == SyncStatus.SYNCED
                && contentHash != null
                && contentHash.equals(platformVersionHashes.get(platform));
    }

    public CardSyncState copy() {
        CardSyncState copy = new CardSyncState();
        copy.setLocalId(localId);
        copy.setFederatedId(federatedId);
        copy.setPlatformIds(new LinkedHashMap<>(platformIds));
        copy.setLastSync(new LinkedHashMap<>(lastSync));
        copy.setPlatformVersionHashes(new LinkedHashMap<>(platformVersionHashes));
        copy.setVersionHash(versionHash);
        copy.setStatus(status);
        return copy;
    }
}
