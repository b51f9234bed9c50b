package io.cardfederation.store;

import com.google.common.util.concurrent.Striped;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.CardSyncState;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write of a single sync state record.
 *
 * <p>Writers in this process (engine, poller, manual bookkeeping) serialize per federated id,
 * so concurrent passes over different platforms do not drop each other's links. A mutation
 * that leaves no platform links deletes the record.
 */
@Slf4j
public class SyncStateUpdater {

    private static final int LOCK_STRIPES = 64;

    private final SyncStateStore store;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

    public SyncStateUpdater(SyncStateStore store) {
        this.store = store;
    }

    public SyncStateStore getStore() {
        return store;
    }

    /**
     * Apply {@code mutation} to the current record (a copy, or empty when absent) and persist the result.
     *
     * @return the stored record, empty if the record ends up deleted or absent
     */
    public Optional<CardSyncState> update(String federatedId, UnaryOperator<Optional<CardSyncState>> mutation)
            throws PersistenceException {
        Lock lock = locks.get(federatedId);
        lock.lock();
        try {
            Optional<CardSyncState> current = store.get(federatedId);
            Optional<CardSyncState> next = mutation.apply(current.map(CardSyncState::copy));

            if (next.isPresent() && next.get().hasPlatformLinks()) {
                CardSyncState state = next.get();
                if (!federatedId.equals(state.getFederatedId())) {
                    throw new IllegalStateException("Mutation changed federated id of " + federatedId);
                }
                store.set(state);
                return Optional.of(state);
            }
            if (current.isPresent()) {
                log.debug("Sync state {} has no platform links left, deleting", federatedId);
                store.delete(federatedId);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }
}
