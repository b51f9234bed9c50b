package io.cardfederation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.FederationSettings;
import io.etcd.jetcd.Client;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * etcd-based implementation of SettingsStore. The snapshot lives under a single key.
 */
@Slf4j
public class EtcdSettingsStore extends AbstractEtcdStore implements SettingsStore {

    public EtcdSettingsStore(Client etcdClient, String namespace, ObjectMapper objectMapper, long operationTimeoutSeconds) {
        super(etcdClient, namespace, objectMapper, operationTimeoutSeconds);
    }

    @Override
    public Optional<FederationSettings.Persisted> load() throws PersistenceException {
        String path = pathResolver.getSettingsPath(namespace);
        try {
            Optional<String> json = executeEtcdGet(path);
            if (json.isEmpty()) {
                log.debug("No federation settings stored at {}", path);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), FederationSettings.Persisted.class));
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to load federation settings from {}: {}", path, e.getMessage(), e);
            throw new PersistenceException("Failed to load federation settings", e);
        }
    }

    @Override
    public void save(FederationSettings settings) throws PersistenceException {
        String path = pathResolver.getSettingsPath(namespace);
        try {
            executeEtcdPut(path, objectMapper.writeValueAsString(settings));
            log.debug("Saved federation settings to {}", path);
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to save federation settings to {}: {}", path, e.getMessage(), e);
            throw new PersistenceException("Failed to save federation settings", e);
        }
    }
}
