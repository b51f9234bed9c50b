package io.cardfederation.reconciliation;

import io.cardfederation.adapters.PlatformAdapter;
import io.cardfederation.adapters.PlatformAdapterFactory;
import io.cardfederation.catalog.LocalCardCatalog;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.enums.SyncStatus;
import io.cardfederation.metrics.MetricsConstants;
import io.cardfederation.metrics.MetricsProvider;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.models.LocalCard;
import io.cardfederation.models.PlatformConfig;
import io.cardfederation.models.PollReport;
import io.cardfederation.models.RemoteCardEntry;
import io.cardfederation.store.SyncStateStore;
import io.cardfederation.store.SyncStateUpdater;
import io.cardfederation.tasks.CancellationToken;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Repairs sync state drift against a platform's outbox listing.
 *
 * <p>A pass first plans every change from a snapshot of the local catalog, the outbox and the
 * stored records, then applies the plan. Cancellation is honoured up to the apply phase only,
 * so a cancelled pass writes nothing. At most one pass per platform is in flight; concurrent
 * requests for the same platform join it.
 */
@Slf4j
public class ReconciliationPoller {

    private final SyncStateUpdater stateUpdater;
    private final SyncStateStore stateStore;
    private final LocalCardCatalog catalog;
    private final PlatformAdapterFactory adapterFactory;
    private final String originUrl;
    private final ExecutorService pollPool;
    private final Clock clock;
    private final MetricsProvider metricsProvider;
    private final ConcurrentMap<PlatformId, CompletableFuture<PollReport>> inFlight = new ConcurrentHashMap<>();

    public ReconciliationPoller(SyncStateUpdater stateUpdater, LocalCardCatalog catalog,
                                PlatformAdapterFactory adapterFactory, String originUrl,
                                ExecutorService pollPool, Clock clock, MetricsProvider metricsProvider) {
        this.stateUpdater = stateUpdater;
        this.stateStore = stateUpdater.getStore();
        this.catalog = catalog;
        this.adapterFactory = adapterFactory;
        this.originUrl = originUrl;
        this.pollPool = pollPool;
        this.clock = clock;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Poll one platform and wait for the report. Never throws.
     */
    public PollReport poll(PlatformId platform, PlatformConfig config, CancellationToken token) {
        return pollAsync(platform, config, token).join();
    }

    /**
     * Start a pass, or join the one already running for {@code platform}.
     * The returned future always completes normally.
     */
    public CompletableFuture<PollReport> pollAsync(PlatformId platform, PlatformConfig config, CancellationToken token) {
        CompletableFuture<PollReport> candidate = new CompletableFuture<>();
        CompletableFuture<PollReport> running = inFlight.putIfAbsent(platform, candidate);
        if (running != null) {
            log.info("[Platform: {}] poll already in flight, joining it", platform);
            return running;
        }

        try {
            pollPool.execute(() -> {
                PollReport report = null;
                try {
                    report = runPoll(platform, config, token);
                } catch (RuntimeException e) {
                    log.error("[Platform: {}] poll aborted: {}", platform, e.getMessage(), e);
                    report = PollReport.failed(platform, e.getMessage(), clock.instant());
                } finally {
                    // joiners must never wait on a pass that died
                    inFlight.remove(platform, candidate);
                    candidate.complete(report != null
                            ? report
                            : PollReport.failed(platform, "poll aborted", clock.instant()));
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[Platform: {}] poll rejected by worker pool: {}", platform, e.getMessage());
            inFlight.remove(platform, candidate);
            candidate.complete(PollReport.failed(platform, "poll pool rejected the task", clock.instant()));
        }
        return candidate;
    }

    public boolean isPolling(PlatformId platform) {
        return inFlight.containsKey(platform);
    }

    public void shutdown() {
        pollPool.shutdown();
        try {
            if (!pollPool.awaitTermination(5, TimeUnit.SECONDS)) {
                pollPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pollPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ===== POLL PASS =====

    PollReport runPoll(PlatformId platform, PlatformConfig config, CancellationToken token) {
        if (platform.isLocal()) {
            return finish(PollReport.skipped(platform, "local platform is not polled", clock.instant()),
                    MetricsConstants.OUTCOME_SKIPPED);
        }
        if (config == null || !config.isEnabled() || !config.hasBaseUrl()) {
            log.info("[Platform: {}] skipping poll, platform is not enabled or has no base URL", platform);
            return finish(PollReport.skipped(platform, "platform is not enabled or has no base URL", clock.instant()),
                    MetricsConstants.OUTCOME_SKIPPED);
        }

        Timer.Sample sample = Timer.start();
        try {
            if (token.isCancelled()) {
                return finish(PollReport.cancelled(platform, clock.instant()), MetricsConstants.OUTCOME_CANCELLED);
            }

            PlatformAdapter adapter = adapterFactory.create(platform, config);
            log.info("[Platform: {}] polling outbox of {}", platform, config.getBaseUrl());
            List<RemoteCardEntry> remoteCards = adapter.listCards();
            List<LocalCard> localCards = catalog.listCards();
            List<CardSyncState> states = stateStore.list();

            ReconciliationPlan plan = plan(platform, remoteCards, localCards, states);

            if (token.isCancelled()) {
                log.info("[Platform: {}] poll cancelled before applying {} changes", platform, plan.changes.size());
                return finish(PollReport.cancelled(platform, clock.instant()), MetricsConstants.OUTCOME_CANCELLED);
            }

            Instant now = clock.instant();
            int created = apply(platform, plan, now);

            PollReport report = PollReport.builder()
                    .platform(platform)
                    .remoteCount(remoteCards.size())
                    .localCount(localCards.size())
                    .matched(plan.matched)
                    .created(created)
                    .unlinked(plan.unlinked)
                    .deleted(plan.deleted)
                    .ambiguousNames(plan.ambiguousNames)
                    .completedAt(now)
                    .build();
            log.info("[Platform: {}] poll complete - remote: {}, local: {}, matched: {}, created: {}, unlinked: {}, deleted: {}",
                    platform, report.getRemoteCount(), report.getLocalCount(), report.getMatched(),
                    report.getCreated(), report.getUnlinked(), report.getDeleted());
            return finish(report, MetricsConstants.OUTCOME_SUCCESS);
        } catch (Exception e) {
            log.error("[Platform: {}] poll failed: {}", platform, e.getMessage(), e);
            return finish(PollReport.failed(platform, e.getMessage(), clock.instant()), MetricsConstants.OUTCOME_FAILURE);
        } finally {
            sample.stop(metricsProvider.pollTimer(platform.getId()));
        }
    }

    /**
     * Decide per local card whether its link to {@code platform} is kept, created or dropped.
     * A stored remote id still present in the outbox wins over a name match.
     */
    ReconciliationPlan plan(PlatformId platform, List<RemoteCardEntry> remoteCards,
                            List<LocalCard> localCards, List<CardSyncState> states) {
        Map<String, RemoteCardEntry> remoteById = new LinkedHashMap<>();
        Map<String, RemoteCardEntry> remoteByName = new HashMap<>();
        for (RemoteCardEntry entry : remoteCards) {
            remoteById.putIfAbsent(entry.getRemoteId(), entry);
            String key = normalizeName(entry.getName());
            if (key != null) {
                remoteByName.putIfAbsent(key, entry);
            }
        }

        Map<String, CardSyncState> stateByLocalId = new HashMap<>();
        for (CardSyncState state : states) {
            stateByLocalId.put(state.getLocalId(), state);
        }

        ReconciliationPlan plan = new ReconciliationPlan();
        Map<String, List<String>> namesByRemoteId = new LinkedHashMap<>();
        for (LocalCard local : localCards) {
            CardSyncState state = stateByLocalId.get(local.getId());
            String linkedRemoteId = state != null ? state.remoteIdOn(platform) : null;

            String matchedRemoteId = null;
            if (linkedRemoteId != null && remoteById.containsKey(linkedRemoteId)) {
                matchedRemoteId = linkedRemoteId;
            } else {
                String key = normalizeName(local.getName());
                RemoteCardEntry byName = key != null ? remoteByName.get(key) : null;
                if (byName != null) {
                    matchedRemoteId = byName.getRemoteId();
                }
            }

            if (matchedRemoteId != null) {
                plan.changes.add(PlannedChange.link(local.getId(), matchedRemoteId));
                plan.matched++;
                namesByRemoteId.computeIfAbsent(matchedRemoteId, ignored -> new ArrayList<>())
                        .add(local.getName());
            } else if (linkedRemoteId != null) {
                plan.changes.add(PlannedChange.unlink(local.getId()));
                plan.unlinked++;
                if (state.getPlatformIds().size() == 1) {
                    plan.deleted++;
                }
            }
        }

        namesByRemoteId.forEach((remoteId, names) -> {
            if (names.size() > 1) {
                log.warn("[Platform: {}] remote card {} matches {} local cards by name: {}",
                        platform, remoteId, names.size(), names);
                plan.ambiguousNames.addAll(names);
            }
        });
        return plan;
    }

    private int apply(PlatformId platform, ReconciliationPlan plan, Instant now) {
        int created = 0;
        for (PlannedChange change : plan.changes) {
            String federatedId = CardSyncState.federatedIdFor(originUrl, change.localId);
            boolean[] wasCreated = {false};
            if (change.remoteId != null) {
                stateUpdater.update(federatedId, current -> {
                    CardSyncState state = current.orElseGet(() -> {
                        wasCreated[0] = true;
                        return CardSyncState.create(originUrl, change.localId);
                    });
                    state.linkPlatform(platform, change.remoteId, now);
                    state.setStatus(SyncStatus.SYNCED);
                    return Optional.of(state);
                });
            } else {
                stateUpdater.update(federatedId, current -> current.map(state -> {
                    state.unlinkPlatform(platform);
                    return state;
                }));
            }
            if (wasCreated[0]) {
                created++;
            }
        }
        return created;
    }

    private PollReport finish(PollReport report, String outcome) {
        metricsProvider.recordPoll(report.getPlatform().getId(), outcome);
        return report;
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    static final class ReconciliationPlan {
        final List<PlannedChange> changes = new ArrayList<>();
        final List<String> ambiguousNames = new ArrayList<>();
        int matched;
        int unlinked;
        int deleted;
    }

    static final class PlannedChange {
        final String localId;
        // null means drop the link
        final String remoteId;

        private PlannedChange(String localId, String remoteId) {
            this.localId = localId;
            this.remoteId = remoteId;
        }

        static PlannedChange link(String localId, String remoteId) {
            return new PlannedChange(localId, remoteId);
        }

        static PlannedChange unlink(String localId) {
            return new PlannedChange(localId, null);
        }
    }
}
