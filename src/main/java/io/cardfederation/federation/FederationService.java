package io.cardfederation.federation;

import io.cardfederation.adapters.PlatformAdapter;
import io.cardfederation.adapters.PlatformAdapterFactory;
import io.cardfederation.enums.FederationState;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncOperation;
import io.cardfederation.enums.SyncStatus;
import io.cardfederation.exceptions.ConfigurationException;
import io.cardfederation.exceptions.FederationException;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.metrics.MetricsConstants;
import io.cardfederation.metrics.MetricsProvider;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.models.FederationSettings;
import io.cardfederation.models.FederationStatus;
import io.cardfederation.models.PlatformConfig;
import io.cardfederation.models.PlatformConfigPatch;
import io.cardfederation.models.PollReport;
import io.cardfederation.models.SyncResult;
import io.cardfederation.reconciliation.ReconciliationPoller;
import io.cardfederation.store.SettingsStore;
import io.cardfederation.store.SyncStateStore;
import io.cardfederation.store.SyncStateUpdater;
import io.cardfederation.sync.AdapterCallExecutor;
import io.cardfederation.sync.SyncEngine;
import io.cardfederation.sync.VersionHasher;
import io.cardfederation.tasks.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the federation subsystem. Owns the settings, the sync engine and its adapter
 * registry, and the cached view of sync states.
 *
 * <p>Lifecycle: {@code UNINITIALIZED -> INITIALIZING -> READY}. Operations initialize lazily.
 */
@Slf4j
public class FederationService {

    private final String originUrl;
    private final String actorId;
    private final SettingsStore settingsStore;
    private final SyncStateUpdater stateUpdater;
    private final SyncStateStore stateStore;
    private final PlatformAdapterFactory adapterFactory;
    private final VersionHasher versionHasher;
    private final AdapterCallExecutor callExecutor;
    private final ReconciliationPoller poller;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    private final Object settingsLock = new Object();
    private final AtomicInteger activeSyncs = new AtomicInteger();

    private volatile FederationState state = FederationState.UNINITIALIZED;
    private volatile SyncEngine engine;
    private volatile FederationSettings settings;
    private volatile SyncResult lastSyncResult;
    private volatile String error;
    private volatile List<CardSyncState> syncStates = List.of();

    public FederationService(String originUrl, String actorId, SettingsStore settingsStore,
                             SyncStateUpdater stateUpdater, PlatformAdapterFactory adapterFactory,
                             VersionHasher versionHasher, AdapterCallExecutor callExecutor,
                             ReconciliationPoller poller, MetricsProvider metricsProvider, Clock clock) {
        this.originUrl = originUrl;
        this.actorId = actorId;
        this.settingsStore = settingsStore;
        this.stateUpdater = stateUpdater;
        this.stateStore = stateUpdater.getStore();
        this.adapterFactory = adapterFactory;
        this.versionHasher = versionHasher;
        this.callExecutor = callExecutor;
        this.poller = poller;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.settings = FederationSettings.defaults(originUrl);
    }

    // ===== LIFECYCLE =====

    public void initialize() {
        initialize(CancellationToken.NONE);
    }

    /**
     * Load settings, build the sync engine, register the editor and every enabled platform, and
     * load the sync states. No-op when already initialized. On failure the error is recorded, the
     * state returns to {@code UNINITIALIZED} and the exception propagates.
     */
    public synchronized void initialize(CancellationToken token) {
        if (state == FederationState.READY) {
            return;
        }
        state = FederationState.INITIALIZING;
        log.info("Initializing federation for origin {}", originUrl);
        try {
            token.throwIfCancelled("Federation initialization");
            FederationSettings loaded = FederationSettings.defaults(originUrl)
                    .mergedWith(settingsStore.load().orElse(null));
            synchronized (settingsLock) {
                settings = loaded;
            }

            SyncEngine newEngine = new SyncEngine(originUrl, actorId, stateUpdater, versionHasher, callExecutor, clock);
            newEngine.registerPlatform(adapterFactory.localEditor());
            for (Map.Entry<PlatformId, PlatformConfig> entry : loaded.getPlatforms().entrySet()) {
                PlatformId platform = entry.getKey();
                PlatformConfig config = entry.getValue();
                if (platform.isLocal() || !config.isEnabled() || !config.hasBaseUrl()) {
                    continue;
                }
                try {
                    newEngine.registerPlatform(adapterFactory.create(platform, config));
                } catch (ConfigurationException e) {
                    log.warn("[Platform: {}] adapter not registered: {}", platform, e.getMessage());
                }
            }

            token.throwIfCancelled("Federation initialization");
            List<CardSyncState> loadedStates = List.copyOf(stateStore.list());

            engine = newEngine;
            syncStates = loadedStates;
            metricsProvider.setTrackedSyncStates(loadedStates.size());
            error = null;
            state = FederationState.READY;
            log.info("Federation ready - platforms: {}, sync states: {}", newEngine.getPlatforms(), loadedStates.size());
        } catch (RuntimeException e) {
            error = "Failed to initialize federation: " + e.getMessage();
            state = FederationState.UNINITIALIZED;
            log.error("Failed to initialize federation: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Drop the current engine and initialize again from the stored settings.
     */
    public synchronized void reinitialize() {
        state = FederationState.UNINITIALIZED;
        initialize(CancellationToken.NONE);
    }

    public FederationState getState() {
        return state;
    }

    private SyncEngine readyEngine() {
        if (state != FederationState.READY) {
            initialize(CancellationToken.NONE);
        }
        return engine;
    }

    /**
     * Settings as loaded from the store. Until initialization succeeds only built-in defaults are
     * in memory, so nothing may read or patch them before that.
     */
    private FederationSettings loadedSettings() {
        readyEngine();
        return settings;
    }

    // ===== SETTINGS =====

    public FederationSettings getSettings() {
        return loadedSettings().copy();
    }

    /**
     * Merge {@code patch} into one platform's config and persist immediately. Other platforms are untouched.
     * When the service is ready, the platform's adapter registration follows the new config.
     */
    public PlatformConfig updatePlatformConfig(PlatformId platform, PlatformConfigPatch patch) {
        readyEngine();
        PlatformConfig updated;
        synchronized (settingsLock) {
            settings = settings.withPlatformPatch(platform, patch);
            updated = settings.platform(platform);
            saveSettings(settings);
        }
        refreshRegistration(platform, updated);
        return updated.toBuilder().build();
    }

    public FederationSettings updateSettings(Boolean autoSync, Integer syncIntervalMinutes) {
        readyEngine();
        synchronized (settingsLock) {
            FederationSettings updated = settings.copy();
            if (autoSync != null) {
                updated.setAutoSync(autoSync);
            }
            if (syncIntervalMinutes != null) {
                if (syncIntervalMinutes <= 0) {
                    throw new ConfigurationException("syncIntervalMinutes must be positive");
                }
                updated.setSyncIntervalMinutes(syncIntervalMinutes);
            }
            settings = updated;
            saveSettings(updated);
            return updated.copy();
        }
    }

    private void saveSettings(FederationSettings snapshot) {
        try {
            settingsStore.save(snapshot);
        } catch (PersistenceException e) {
            error = "Failed to save federation settings: " + e.getMessage();
            log.error("Failed to save federation settings: {}", e.getMessage(), e);
        }
    }

    private void refreshRegistration(PlatformId platform, PlatformConfig config) {
        SyncEngine current = engine;
        if (state != FederationState.READY || current == null || platform.isLocal()) {
            return;
        }
        if (config.isEnabled() && config.hasBaseUrl()) {
            current.registerPlatform(adapterFactory.create(platform, config));
        } else {
            current.unregisterPlatform(platform);
        }
    }

    // ===== CONNECTIONS =====

    public boolean testConnection(PlatformId platform) {
        return testConnection(platform, CancellationToken.NONE);
    }

    /**
     * Probe the platform with a freshly built adapter and store {@code connected} and {@code lastChecked}.
     * Never throws; any failure reads as not connected. Nothing is stored when the settings could not be
     * loaded or the probe was cancelled.
     */
    public boolean testConnection(PlatformId platform, CancellationToken token) {
        PlatformConfig config;
        try {
            config = loadedSettings().platform(platform);
        } catch (RuntimeException e) {
            log.warn("[Platform: {}] connection test skipped, federation not initialized: {}", platform, e.getMessage());
            return false;
        }

        boolean connected = false;
        if (config != null && (platform.isLocal() || config.hasBaseUrl())) {
            try {
                PlatformAdapter adapter = adapterFactory.create(platform, config);
                connected = callExecutor.call(platform, "connection test", adapter::isAvailable, token);
            } catch (RuntimeException e) {
                log.warn("[Platform: {}] connection test failed: {}", platform, e.getMessage());
            }
        } else {
            log.info("[Platform: {}] connection test skipped, no base URL configured", platform);
        }
        if (token.isCancelled()) {
            log.info("[Platform: {}] connection test cancelled", platform);
            return false;
        }

        Instant now = clock.instant();
        synchronized (settingsLock) {
            settings = settings.withPlatformPatch(platform, PlatformConfigPatch.connectionResult(connected, now));
            saveSettings(settings);
        }
        metricsProvider.recordConnectionCheck(platform.getId(), connected);
        log.info("[Platform: {}] connection test result: {}", platform, connected ? "connected" : "unreachable");
        return connected;
    }

    /**
     * Enable the platform, rebuild the adapter registry and test the connection. The platform stays
     * enabled when the test fails.
     *
     * @throws ConfigurationException when the platform has no base URL
     */
    public boolean connectPlatform(PlatformId platform) {
        PlatformConfig config = loadedSettings().platform(platform);
        if (config == null || !config.hasBaseUrl()) {
            throw new ConfigurationException("Cannot connect " + platform + ": no base URL configured");
        }

        updatePlatformConfig(platform, PlatformConfigPatch.enabled(true));
        reinitialize();
        boolean connected = testConnection(platform);
        if (!connected) {
            error = "Failed to connect to " + platform;
        }
        return connected;
    }

    /**
     * Disable the platform and drop its adapter. Its sync history is kept.
     */
    public void disconnectPlatform(PlatformId platform) {
        if (platform.isLocal()) {
            throw new ConfigurationException("The local editor cannot be disconnected");
        }
        updatePlatformConfig(platform, PlatformConfigPatch.disconnected());
        SyncEngine current = engine;
        if (current != null) {
            current.unregisterPlatform(platform);
        }
        log.info("[Platform: {}] disconnected", platform);
    }

    public List<PlatformId> getRegisteredPlatforms() {
        SyncEngine current = engine;
        return current != null ? current.getPlatforms() : List.of();
    }

    // ===== SYNC =====

    public SyncResult syncCard(String localId, PlatformId target) {
        return syncCard(localId, target, CancellationToken.NONE);
    }

    /**
     * Push a local card to {@code target}.
     */
    public SyncResult syncCard(String localId, PlatformId target, CancellationToken token) {
        return runSync(SyncOperation.PUSH, target, localId,
                () -> readyEngine().pushCard(PlatformId.EDITOR, localId, target, token));
    }

    public SyncResult pushToSillyTavern(String localId) {
        return syncCard(localId, PlatformId.SILLYTAVERN);
    }

    public SyncResult pushToArchive(String localId) {
        return syncCard(localId, PlatformId.ARCHIVE);
    }

    public SyncResult pullFromHub(String hubCardId) {
        return pullCard(PlatformId.HUB, hubCardId);
    }

    public SyncResult pullCard(PlatformId source, String remoteId) {
        return pullCard(source, remoteId, CancellationToken.NONE);
    }

    /**
     * Pull a remote card into the local editor.
     */
    public SyncResult pullCard(PlatformId source, String remoteId, CancellationToken token) {
        return runSync(SyncOperation.PULL, source, remoteId,
                () -> readyEngine().pullCard(source, remoteId, PlatformId.EDITOR, token));
    }

    public boolean isSyncing() {
        return activeSyncs.get() > 0;
    }

    public SyncResult getLastSyncResult() {
        return lastSyncResult;
    }

    public String getError() {
        return error;
    }

    private SyncResult runSync(SyncOperation operation, PlatformId platform, String cardId, SyncCall call) {
        activeSyncs.incrementAndGet();
        error = null;
        try {
            SyncResult result = call.run();
            lastSyncResult = result;
            metricsProvider.recordSyncOperation(operation.toString(), platform.getId(),
                    result.isSkipped() ? MetricsConstants.OUTCOME_SKIPPED : MetricsConstants.OUTCOME_SUCCESS);
            refreshSyncStatesQuietly();
            return result;
        } catch (FederationException e) {
            error = e.getMessage();
            lastSyncResult = SyncResult.builder()
                    .success(false)
                    .operation(operation)
                    .platform(platform)
                    .localId(operation == SyncOperation.PUSH ? cardId : null)
                    .remoteId(operation == SyncOperation.PULL ? cardId : null)
                    .timestamp(clock.instant())
                    .error(e.getMessage())
                    .build();
            metricsProvider.recordSyncOperation(operation.toString(), platform.getId(), MetricsConstants.OUTCOME_FAILURE);
            throw e;
        } finally {
            activeSyncs.decrementAndGet();
        }
    }

    @FunctionalInterface
    private interface SyncCall {
        SyncResult run();
    }

    // ===== SYNC STATE BOOKKEEPING =====

    /**
     * Record that a card exists on a platform without moving any content. Repeating the call with
     * the same arguments leaves a single record.
     *
     * @param remoteId id on the platform, defaults to {@code localId}
     */
    public CardSyncState recordManualSync(String localId, PlatformId platform, String remoteId) {
        readyEngine();
        String effectiveRemoteId = remoteId != null && !remoteId.isBlank() ? remoteId : localId;
        String federatedId = CardSyncState.federatedIdFor(originUrl, localId);
        Instant now = clock.instant();

        CardSyncState recorded = stateUpdater.update(federatedId, current -> {
            CardSyncState record = current.orElseGet(() -> CardSyncState.create(originUrl, localId));
            record.linkPlatform(platform, effectiveRemoteId, now);
            record.setStatus(SyncStatus.SYNCED);
            return Optional.of(record);
        }).orElseThrow(() -> new IllegalStateException("Sync state " + federatedId + " was not stored"));

        log.info("[Platform: {}] recorded manual sync of card {} as {}", platform, localId, effectiveRemoteId);
        refreshSyncStatesQuietly();
        return recorded;
    }

    public Optional<CardSyncState> findSyncState(PlatformId platform, String remoteId) {
        return stateStore.findByPlatformId(platform, remoteId);
    }

    public Optional<CardSyncState> findSyncStateByLocalId(String localId) {
        return stateStore.findByLocalId(localId);
    }

    public List<CardSyncState> getSyncStates() {
        return syncStates;
    }

    /**
     * Reload the cached sync states from the store.
     */
    public List<CardSyncState> refreshSyncStates() {
        List<CardSyncState> loaded = List.copyOf(stateStore.list());
        syncStates = loaded;
        metricsProvider.setTrackedSyncStates(loaded.size());
        return loaded;
    }

    private void refreshSyncStatesQuietly() {
        try {
            refreshSyncStates();
        } catch (PersistenceException e) {
            log.warn("Failed to refresh sync state cache: {}", e.getMessage());
        }
    }

    public void clearSyncState(String federatedId) {
        stateStore.delete(federatedId);
        log.info("Cleared sync state {}", federatedId);
        refreshSyncStatesQuietly();
    }

    public FederationStatus getStatus() {
        return FederationStatus.builder()
                .state(state)
                .syncing(isSyncing())
                .lastSyncResult(lastSyncResult)
                .error(error)
                .registeredPlatforms(getRegisteredPlatforms())
                .syncStates(syncStates)
                .build();
    }

    // ===== RECONCILIATION =====

    public PollReport pollPlatformSyncState(PlatformId platform) {
        return pollPlatformSyncState(platform, CancellationToken.NONE);
    }

    /**
     * Reconcile one platform against its outbox. Never throws; failures are reported in the result.
     */
    public PollReport pollPlatformSyncState(PlatformId platform, CancellationToken token) {
        FederationSettings snapshot;
        try {
            snapshot = loadedSettings();
        } catch (RuntimeException e) {
            log.error("[Platform: {}] poll not started, federation not initialized: {}", platform, e.getMessage());
            return PollReport.failed(platform, "Federation not initialized: " + e.getMessage(), clock.instant());
        }
        PollReport report = poller.poll(platform, snapshot.platform(platform), token);
        if (report.hasChanges()) {
            refreshSyncStatesQuietly();
        }
        return report;
    }

    public List<PollReport> pollAllPlatforms() {
        return pollAllPlatforms(CancellationToken.NONE);
    }

    /**
     * Reconcile every enabled remote platform. Platforms are polled concurrently and fail independently.
     */
    public List<PollReport> pollAllPlatforms(CancellationToken token) {
        FederationSettings snapshot;
        try {
            snapshot = loadedSettings();
        } catch (RuntimeException e) {
            log.error("Polls not started, federation not initialized: {}", e.getMessage());
            return List.of();
        }
        List<CompletableFuture<PollReport>> pending = new ArrayList<>();
        snapshot.getPlatforms().forEach((platform, config) -> {
            if (!platform.isLocal() && config.isEnabled() && config.hasBaseUrl()) {
                pending.add(poller.pollAsync(platform, config, token));
            }
        });

        List<PollReport> reports = new ArrayList<>();
        for (CompletableFuture<PollReport> future : pending) {
            reports.add(future.join());
        }
        if (reports.stream().anyMatch(PollReport::hasChanges)) {
            refreshSyncStatesQuietly();
        }
        log.info("Polled {} platforms", reports.size());
        return reports;
    }
}
