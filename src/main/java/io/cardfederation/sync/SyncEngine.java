package io.cardfederation.sync;

import io.cardfederation.adapters.PlatformAdapter;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncOperation;
import io.cardfederation.enums.SyncStatus;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.exceptions.ConfigurationException;
import io.cardfederation.exceptions.SyncOperationException;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.models.SyncResult;
import io.cardfederation.store.SyncStateStore;
import io.cardfederation.store.SyncStateUpdater;
import io.cardfederation.tasks.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Moves one card between two registered platforms and records the outcome in the sync state store.
 *
 * <p>Sync state is written only after every adapter call of an operation succeeded. A failed
 * operation leaves the stored record exactly as it was and surfaces as {@link SyncOperationException}.
 */
@Slf4j
public class SyncEngine {

    private final String originUrl;
    private final String actorId;
    private final SyncStateUpdater stateUpdater;
    private final SyncStateStore stateStore;
    private final VersionHasher versionHasher;
    private final AdapterCallExecutor callExecutor;
    private final Clock clock;
    private final Map<PlatformId, PlatformAdapter> adapters = new ConcurrentHashMap<>();

    public SyncEngine(String originUrl, String actorId, SyncStateUpdater stateUpdater,
                      VersionHasher versionHasher, AdapterCallExecutor callExecutor, Clock clock) {
        this.originUrl = originUrl;
        this.actorId = actorId;
        this.stateUpdater = stateUpdater;
        this.stateStore = stateUpdater.getStore();
        this.versionHasher = versionHasher;
        this.callExecutor = callExecutor;
        this.clock = clock;
        log.info("SyncEngine created for actor {}", actorId);
    }

    public String getActorId() {
        return actorId;
    }

    // ===== PLATFORM REGISTRY =====

    public void registerPlatform(PlatformAdapter adapter) {
        PlatformAdapter previous = adapters.put(adapter.getPlatform(), adapter);
        log.info("[Platform: {}] registered adapter {}{}", adapter.getPlatform(), adapter.getDisplayName(),
                previous != null ? " (replaced previous)" : "");
    }

    /**
     * Remove the adapter. Sync history of the platform is kept.
     */
    public void unregisterPlatform(PlatformId platform) {
        if (adapters.remove(platform) != null) {
            log.info("[Platform: {}] unregistered adapter", platform);
        }
    }

    public List<PlatformId> getPlatforms() {
        return adapters.keySet().stream().sorted().collect(Collectors.toList());
    }

    public Optional<PlatformAdapter> getAdapter(PlatformId platform) {
        return Optional.ofNullable(adapters.get(platform));
    }

    // ===== SYNC OPERATIONS =====

    public SyncResult pushCard(PlatformId source, String localId, PlatformId target) {
        return pushCard(source, localId, target, CancellationToken.NONE);
    }

    /**
     * Read {@code localId} from {@code source} and write it to {@code target}. When the target already
     * holds content with the same hash the remote write is skipped.
     */
    public SyncResult pushCard(PlatformId source, String localId, PlatformId target, CancellationToken token) {
        PlatformAdapter sourceAdapter = requireAdapter(source);
        PlatformAdapter targetAdapter = requireAdapter(target);
        requireDistinct(source, target);

        String federatedId = CardSyncState.federatedIdFor(originUrl, localId);
        try {
            AdapterCard card = callExecutor.call(source, "pull card " + localId,
                    () -> sourceAdapter.pullCard(localId), token);
            String contentHash = versionHasher.hash(source, card.getCard());

            Optional<CardSyncState> existing = stateStore.get(federatedId);
            if (existing.isPresent() && existing.get().isUpToDateOn(target, contentHash)) {
                log.info("[Platform: {}] card {} unchanged since last push, skipping", target, localId);
                return SyncResult.builder()
                        .success(true)
                        .operation(SyncOperation.PUSH)
                        .platform(target)
                        .localId(localId)
                        .remoteId(existing.get().remoteIdOn(target))
                        .federatedId(federatedId)
                        .timestamp(clock.instant())
                        .skipped(true)
                        .build();
            }

            String existingRemoteId = existing.map(state -> state.remoteIdOn(target)).orElse(null);
            String remoteId = callExecutor.call(target, "push card " + localId,
                    () -> targetAdapter.pushCard(card, existingRemoteId), token);

            Instant now = clock.instant();
            stateUpdater.update(federatedId, current -> {
                CardSyncState state = current.orElseGet(() -> CardSyncState.create(originUrl, localId));
                state.linkPlatform(target, remoteId, now, contentHash);
                state.setVersionHash(contentHash);
                state.setStatus(SyncStatus.SYNCED);
                return Optional.of(state);
            });

            log.info("[Platform: {}] pushed card {} from {} as {}", target, localId, source, remoteId);
            return SyncResult.builder()
                    .success(true)
                    .operation(SyncOperation.PUSH)
                    .platform(target)
                    .localId(localId)
                    .remoteId(remoteId)
                    .federatedId(federatedId)
                    .timestamp(now)
                    .build();
        } catch (AdapterCallException e) {
            log.error("[Platform: {}] push of card {} failed: {}", target, localId, e.getMessage());
            throw new SyncOperationException(SyncOperation.PUSH, e);
        }
    }

    public SyncResult pullCard(PlatformId source, String remoteId, PlatformId target) {
        return pullCard(source, remoteId, target, CancellationToken.NONE);
    }

    /**
     * Read {@code remoteId} from {@code source} and materialize it on {@code target}, normally the editor.
     * A card pulled before is written over its previous copy instead of being duplicated.
     */
    public SyncResult pullCard(PlatformId source, String remoteId, PlatformId target, CancellationToken token) {
        PlatformAdapter sourceAdapter = requireAdapter(source);
        PlatformAdapter targetAdapter = requireAdapter(target);
        requireDistinct(source, target);

        try {
            AdapterCard card = callExecutor.call(source, "pull card " + remoteId,
                    () -> sourceAdapter.pullCard(remoteId), token);
            String contentHash = versionHasher.hash(source, card.getCard());

            Optional<CardSyncState> existing = stateStore.findByPlatformId(source, remoteId);
            String existingTargetId = existing
                    .map(state -> target.isLocal() ? state.getLocalId() : state.remoteIdOn(target))
                    .orElse(null);
            String targetId = callExecutor.call(target, "store card " + remoteId,
                    () -> targetAdapter.pushCard(card, existingTargetId), token);

            String localId = target.isLocal()
                    ? targetId
                    : existing.map(CardSyncState::getLocalId).orElse(targetId);
            String federatedId = CardSyncState.federatedIdFor(originUrl, localId);

            Instant now = clock.instant();
            stateUpdater.update(federatedId, current -> {
                CardSyncState state = current.orElseGet(() -> CardSyncState.create(originUrl, localId));
                state.linkPlatform(source, remoteId, now, contentHash);
                if (!target.isLocal()) {
                    state.linkPlatform(target, targetId, now, contentHash);
                }
                state.setVersionHash(contentHash);
                state.setStatus(SyncStatus.SYNCED);
                return Optional.of(state);
            });

            log.info("[Platform: {}] pulled card {} into {} as {}", source, remoteId, target, targetId);
            return SyncResult.builder()
                    .success(true)
                    .operation(SyncOperation.PULL)
                    .platform(source)
                    .localId(localId)
                    .remoteId(remoteId)
                    .federatedId(federatedId)
                    .timestamp(now)
                    .build();
        } catch (AdapterCallException e) {
            log.error("[Platform: {}] pull of card {} failed: {}", source, remoteId, e.getMessage());
            throw new SyncOperationException(SyncOperation.PULL, e);
        }
    }

    private PlatformAdapter requireAdapter(PlatformId platform) {
        PlatformAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            throw new ConfigurationException("Platform " + platform + " is not registered");
        }
        return adapter;
    }

    private static void requireDistinct(PlatformId source, PlatformId target) {
        if (source == target) {
            throw new ConfigurationException("Source and target platform are both " + source);
        }
    }
}
