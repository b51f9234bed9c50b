package io.cardfederation.reconciliation;

import io.cardfederation.adapters.PlatformAdapterFactory;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.metrics.MetricsConstants;
import io.cardfederation.metrics.MetricsProvider;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.models.PlatformConfig;
import io.cardfederation.models.PollReport;
import io.cardfederation.models.RemoteCardEntry;
import io.cardfederation.store.SyncStateUpdater;
import io.cardfederation.support.FakePlatformAdapter;
import io.cardfederation.support.InMemoryLocalCardCatalog;
import io.cardfederation.support.InMemorySyncStateStore;
import io.cardfederation.tasks.CancellationToken;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationPollerTest {

    private static final String ORIGIN = "http://localhost:3456";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant EARLIER = Instant.parse("2024-04-01T08:00:00Z");

    private InMemorySyncStateStore store;
    private InMemoryLocalCardCatalog catalog;
    private FakePlatformAdapter sillyTavern;
    private PlatformAdapterFactory adapterFactory;
    private SimpleMeterRegistry meterRegistry;
    private ReconciliationPoller poller;

    @BeforeEach
    void setUp() {
        store = new InMemorySyncStateStore();
        catalog = new InMemoryLocalCardCatalog();
        sillyTavern = new FakePlatformAdapter(PlatformId.SILLYTAVERN);
        adapterFactory = mock(PlatformAdapterFactory.class);
        when(adapterFactory.create(eq(PlatformId.SILLYTAVERN), any())).thenAnswer(invocation -> sillyTavern);
        meterRegistry = new SimpleMeterRegistry();
        poller = new ReconciliationPoller(new SyncStateUpdater(store), catalog, adapterFactory, ORIGIN,
                Executors.newFixedThreadPool(2), Clock.fixed(NOW, ZoneOffset.UTC),
                new MetricsProvider(meterRegistry, ORIGIN));
    }

    @AfterEach
    void tearDown() {
        poller.shutdown();
    }

    private static PlatformConfig tavernConfig() {
        return PlatformConfig.builder()
                .id(PlatformId.SILLYTAVERN)
                .name("SillyTavern")
                .baseUrl("http://localhost:8000")
                .enabled(true)
                .build();
    }

    private void storeState(String localId, PlatformId platform, String remoteId) {
        CardSyncState state = store.get(CardSyncState.federatedIdFor(ORIGIN, localId))
                .orElseGet(() -> CardSyncState.create(ORIGIN, localId));
        state.linkPlatform(platform, remoteId, EARLIER);
        store.set(state);
    }

    private CardSyncState stateOf(String localId) {
        return store.get(CardSyncState.federatedIdFor(ORIGIN, localId)).orElse(null);
    }

    private PollReport poll() {
        return poller.poll(PlatformId.SILLYTAVERN, tavernConfig(), CancellationToken.NONE);
    }

    @Test
    void testNameMatchCreatesRecord() {
        // Given
        catalog.add("aria", "Aria");
        sillyTavern.put("42", "aria");

        // When
        PollReport report = poll();

        // Then
        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.getRemoteCount()).isEqualTo(1);
        assertThat(report.getLocalCount()).isEqualTo(1);
        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(report.getCreated()).isEqualTo(1);
        assertThat(report.getCompletedAt()).isEqualTo(NOW);
        CardSyncState state = stateOf("aria");
        assertThat(state.remoteIdOn(PlatformId.SILLYTAVERN)).isEqualTo("42");
        assertThat(state.getLastSync()).containsEntry(PlatformId.SILLYTAVERN, NOW);
    }

    @Test
    void testRemovedRemoteCardDeletesSinglePlatformRecord() {
        // Given
        catalog.add("aria", "Aria");
        storeState("aria", PlatformId.SILLYTAVERN, "42");

        // When
        PollReport report = poll();

        // Then
        assertThat(report.getUnlinked()).isEqualTo(1);
        assertThat(report.getDeleted()).isEqualTo(1);
        assertThat(stateOf("aria")).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    void testRemovedRemoteCardKeepsOtherLinks() {
        catalog.add("aria", "Aria");
        storeState("aria", PlatformId.SILLYTAVERN, "42");
        storeState("aria", PlatformId.HUB, "h-1");

        PollReport report = poll();

        assertThat(report.getUnlinked()).isEqualTo(1);
        assertThat(report.getDeleted()).isZero();
        CardSyncState state = stateOf("aria");
        assertThat(state.getPlatformIds()).containsOnlyKeys(PlatformId.HUB);
        assertThat(state.getLastSync()).containsOnlyKeys(PlatformId.HUB);
    }

    @Test
    void testStoredLinkWinsOverNameMatch() {
        catalog.add("aria", "Aria");
        storeState("aria", PlatformId.SILLYTAVERN, "42");
        sillyTavern.put("42", "Aria (renamed remotely)");
        sillyTavern.put("43", "Aria");

        PollReport report = poll();

        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(report.getCreated()).isZero();
        assertThat(stateOf("aria").remoteIdOn(PlatformId.SILLYTAVERN)).isEqualTo("42");
    }

    @Test
    void testStaleLinkIsRepairedByName() {
        catalog.add("aria", "Aria");
        storeState("aria", PlatformId.SILLYTAVERN, "41");
        sillyTavern.put("42", "Aria");

        PollReport report = poll();

        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(report.getUnlinked()).isZero();
        assertThat(stateOf("aria").remoteIdOn(PlatformId.SILLYTAVERN)).isEqualTo("42");
    }

    @Test
    void testDuplicateLocalNamesAreReportedAsAmbiguous() {
        // Given
        catalog.add("echo-1", "Echo");
        catalog.add("echo-2", "Echo");
        sillyTavern.put("7", "Echo");

        // When
        PollReport report = poll();

        // Then
        assertThat(report.getMatched()).isEqualTo(2);
        assertThat(report.getCreated()).isEqualTo(2);
        assertThat(report.getAmbiguousNames()).containsExactly("Echo", "Echo");
        assertThat(stateOf("echo-1").remoteIdOn(PlatformId.SILLYTAVERN)).isEqualTo("7");
        assertThat(stateOf("echo-2").remoteIdOn(PlatformId.SILLYTAVERN)).isEqualTo("7");
    }

    @Test
    void testUnmatchedCardsWithoutLinkAreIgnored() {
        catalog.add("solo", "Solo");
        sillyTavern.put("99", "Someone Else");

        PollReport report = poll();

        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.hasChanges()).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void testAdapterFailureIsReportedAndWritesNothing() {
        // Given
        catalog.add("aria", "Aria");
        storeState("aria", PlatformId.SILLYTAVERN, "42");
        int writesBefore = store.getWrites();
        sillyTavern.failWith(FailureKind.CONNECTIVITY);

        // When
        PollReport report = poll();

        // Then
        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.isSkipped()).isFalse();
        assertThat(report.getError()).contains("CONNECTIVITY");
        assertThat(store.getWrites()).isEqualTo(writesBefore);
        assertThat(stateOf("aria")).isNotNull();
        assertThat(meterRegistry.get(MetricsConstants.POLL_METRIC_NAME)
                .tag(MetricsConstants.OUTCOME_TAG, MetricsConstants.OUTCOME_FAILURE)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void testCatalogFailureIsReported() {
        catalog.setFailing(true);
        sillyTavern.put("42", "Aria");

        PollReport report = poll();

        assertThat(report.getError()).isEqualTo("catalog unavailable");
        assertThat(store.size()).isZero();
    }

    @Test
    void testDisabledOrLocalPlatformIsSkipped() {
        PlatformConfig disabled = tavernConfig().toBuilder().enabled(false).build();

        PollReport report = poller.poll(PlatformId.SILLYTAVERN, disabled, CancellationToken.NONE);
        PollReport local = poller.poll(PlatformId.EDITOR, null, CancellationToken.NONE);

        assertThat(report.isSkipped()).isTrue();
        assertThat(local.isSkipped()).isTrue();
        verify(adapterFactory, never()).create(any(), any());
    }

    @Test
    void testCancellationBeforeApplyWritesNothing() {
        // Given
        catalog.add("aria", "Aria");
        CancellationToken token = CancellationToken.create();
        FakePlatformAdapter cancellingAdapter = new FakePlatformAdapter(PlatformId.SILLYTAVERN) {
            @Override
            public synchronized List<RemoteCardEntry> listCards() {
                List<RemoteCardEntry> entries = super.listCards();
                token.cancel();
                return entries;
            }
        };
        cancellingAdapter.put("42", "Aria");
        when(adapterFactory.create(eq(PlatformId.SILLYTAVERN), any())).thenAnswer(invocation -> cancellingAdapter);

        // When
        PollReport report = poller.poll(PlatformId.SILLYTAVERN, tavernConfig(), token);

        // Then
        assertThat(report.isCancelled()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void testConcurrentPollsOfOnePlatformAreCoalesced() throws Exception {
        // Given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger listings = new AtomicInteger();
        FakePlatformAdapter blockingAdapter = new FakePlatformAdapter(PlatformId.SILLYTAVERN) {
            @Override
            public List<RemoteCardEntry> listCards() {
                listings.incrementAndGet();
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.listCards();
            }
        };
        when(adapterFactory.create(eq(PlatformId.SILLYTAVERN), any())).thenAnswer(invocation -> blockingAdapter);

        // When
        CompletableFuture<PollReport> first = poller.pollAsync(PlatformId.SILLYTAVERN, tavernConfig(), CancellationToken.NONE);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<PollReport> second = poller.pollAsync(PlatformId.SILLYTAVERN, tavernConfig(), CancellationToken.NONE);
        assertThat(poller.isPolling(PlatformId.SILLYTAVERN)).isTrue();
        release.countDown();

        // Then
        assertThat(second).isSameAs(first);
        assertThat(first.get(5, TimeUnit.SECONDS).isSuccessful()).isTrue();
        assertThat(listings).hasValue(1);
        assertThat(poller.isPolling(PlatformId.SILLYTAVERN)).isFalse();
    }

    @Test
    void testPollTimerIsRecorded() {
        sillyTavern.put("42", "Aria");

        poll();

        assertThat(meterRegistry.get(MetricsConstants.POLL_DURATION_METRIC_NAME)
                .tag(MetricsConstants.PLATFORM_TAG, "sillytavern")
                .timer().count()).isEqualTo(1L);
        assertThat(meterRegistry.get(MetricsConstants.POLL_METRIC_NAME)
                .tag(MetricsConstants.OUTCOME_TAG, MetricsConstants.OUTCOME_SUCCESS)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void testPassDyingOutsideThePollStillCompletesAndClearsInFlight() throws Exception {
        // Given
        MetricsProvider brokenMetrics = mock(MetricsProvider.class);
        doThrow(new IllegalStateException("registry closed")).when(brokenMetrics).recordPoll(any(), any());
        ReconciliationPoller brokenPoller = new ReconciliationPoller(new SyncStateUpdater(store), catalog,
                adapterFactory, ORIGIN, Executors.newSingleThreadExecutor(), Clock.fixed(NOW, ZoneOffset.UTC),
                brokenMetrics);
        PlatformConfig disabled = tavernConfig().toBuilder().enabled(false).build();

        try {
            // When
            PollReport first = brokenPoller.pollAsync(PlatformId.SILLYTAVERN, disabled, CancellationToken.NONE)
                    .get(5, TimeUnit.SECONDS);
            PollReport second = brokenPoller.pollAsync(PlatformId.SILLYTAVERN, disabled, CancellationToken.NONE)
                    .get(5, TimeUnit.SECONDS);

            // Then
            assertThat(first.isSuccessful()).isFalse();
            assertThat(first.getError()).isEqualTo("registry closed");
            assertThat(second.getError()).isEqualTo("registry closed");
            assertThat(brokenPoller.isPolling(PlatformId.SILLYTAVERN)).isFalse();
        } finally {
            brokenPoller.shutdown();
        }
    }
}
