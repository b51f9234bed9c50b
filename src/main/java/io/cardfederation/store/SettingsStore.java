package io.cardfederation.store;

import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.FederationSettings;

import java.util.Optional;

/**
 * Storage of the federation settings snapshot, read whole and written whole.
 */
public interface SettingsStore {

    /**
     * Load the stored snapshot, empty when nothing was saved yet
     */
    Optional<FederationSettings.Persisted> load() throws PersistenceException;

    /**
     * Replace the stored snapshot
     */
    void save(FederationSettings settings) throws PersistenceException;
}
