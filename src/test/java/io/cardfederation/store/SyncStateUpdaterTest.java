package io.cardfederation.store;

import io.cardfederation.enums.PlatformId;
import io.cardfederation.models.CardSyncState;
import io.cardfederation.support.InMemorySyncStateStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncStateUpdaterTest {

    private static final String ORIGIN = "http://localhost:3456";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemorySyncStateStore store = new InMemorySyncStateStore();
    private final SyncStateUpdater updater = new SyncStateUpdater(store);

    @Test
    void testUpdate_CreatesRecord() {
        String federatedId = CardSyncState.federatedIdFor(ORIGIN, "aria");

        Optional<CardSyncState> stored = updater.update(federatedId, current -> {
            CardSyncState state = current.orElseGet(() -> CardSyncState.create(ORIGIN, "aria"));
            state.linkPlatform(PlatformId.HUB, "h-1", NOW);
            return Optional.of(state);
        });

        assertThat(stored).isPresent();
        assertThat(store.get(federatedId)).contains(stored.get());
    }

    @Test
    void testUpdate_RemovingLastLinkDeletesRecord() {
        CardSyncState aria = CardSyncState.create(ORIGIN, "aria");
        aria.linkPlatform(PlatformId.SILLYTAVERN, "42", NOW);
        store.set(aria);

        Optional<CardSyncState> result = updater.update(aria.getFederatedId(), current -> current.map(state -> {
            state.unlinkPlatform(PlatformId.SILLYTAVERN);
            return state;
        }));

        assertThat(result).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void testUpdate_EmptyRecordIsNeverWritten() {
        String federatedId = CardSyncState.federatedIdFor(ORIGIN, "ghost");

        updater.update(federatedId, current -> Optional.of(CardSyncState.create(ORIGIN, "ghost")));

        assertThat(store.size()).isZero();
        assertThat(store.getWrites()).isZero();
    }

    @Test
    void testUpdate_MutationSeesCopy() {
        CardSyncState aria = CardSyncState.create(ORIGIN, "aria");
        aria.linkPlatform(PlatformId.HUB, "h-1", NOW);
        store.set(aria);

        assertThatThrownBy(() -> updater.update(aria.getFederatedId(), current -> {
            current.get().unlinkPlatform(PlatformId.HUB);
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.get(aria.getFederatedId()).get().isLinkedTo(PlatformId.HUB)).isTrue();
    }

    @Test
    void testConcurrentUpdatesOfOneRecordKeepEveryLink() throws Exception {
        String federatedId = CardSyncState.federatedIdFor(ORIGIN, "aria");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                PlatformId platform = PlatformId.values()[1 + i % 6];
                String remoteId = platform.getId() + "-" + i;
                futures.add(CompletableFuture.runAsync(() -> updater.update(federatedId, current -> {
                    CardSyncState state = current.orElseGet(() -> CardSyncState.create(ORIGIN, "aria"));
                    state.linkPlatform(platform, remoteId, NOW);
                    return Optional.of(state);
                }), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get(federatedId).get().getPlatformIds()).hasSize(6);
    }
}
