package io.cardfederation.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.FederationSettings;
import io.cardfederation.store.SettingsStore;
import io.cardfederation.util.JsonUtils;

import java.util.Optional;

/**
 * SettingsStore holding the JSON snapshot in memory, so saved settings go through the same
 * serialization as the etcd store.
 */
public class InMemorySettingsStore implements SettingsStore {

    private final ObjectMapper objectMapper = JsonUtils.createObjectMapper();
    private volatile String snapshot;
    private volatile int saves;
    private volatile boolean failing;

    public InMemorySettingsStore() {
    }

    public InMemorySettingsStore(String snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public Optional<FederationSettings.Persisted> load() {
        if (failing) {
            throw new PersistenceException("settings unavailable", new IllegalStateException("down"));
        }
        if (snapshot == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(snapshot, FederationSettings.Persisted.class));
        } catch (Exception e) {
            throw new PersistenceException("unreadable snapshot", e);
        }
    }

    @Override
    public void save(FederationSettings settings) {
        if (failing) {
            throw new PersistenceException("settings unavailable", new IllegalStateException("down"));
        }
        try {
            snapshot = objectMapper.writeValueAsString(settings);
            saves++;
        } catch (Exception e) {
            throw new PersistenceException("unwritable snapshot", e);
        }
    }

    public String getSnapshot() {
        return snapshot;
    }

    public int getSaves() {
        return saves;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
