package io.cardfederation.store;

import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.CardSyncState;

import java.util.List;
import java.util.Optional;

/**
 * Durable keyed storage of {@link CardSyncState} records, keyed by federated id.
 * Writes are atomic per key and last-writer-wins; there are no cross-key transactions.
 */
public interface SyncStateStore {

    /**
     * Get all sync state records
     */
    List<CardSyncState> list() throws PersistenceException;

    /**
     * Get a record by federated id
     */
    Optional<CardSyncState> get(String federatedId) throws PersistenceException;

    /**
     * Create or replace a record
     */
    void set(CardSyncState state) throws PersistenceException;

    /**
     * Delete a record. Deleting a missing record is not an error.
     */
    void delete(String federatedId) throws PersistenceException;

    /**
     * Find the record linking the given remote id on a platform
     */
    default Optional<CardSyncState> findByPlatformId(PlatformId platform, String remoteId) throws PersistenceException {
        if (remoteId == null) {
            return Optional.empty();
        }
        return list().stream()
                .filter(state -> remoteId.equals(state.remoteIdOn(platform)))
                .findFirst();
    }

    /**
     * Find the record of a local card
     */
    default Optional<CardSyncState> findByLocalId(String localId) throws PersistenceException {
        if (localId == null) {
            return Optional.empty();
        }
        return list().stream()
                .filter(state -> localId.equals(state.getLocalId()))
                .findFirst();
    }
}
