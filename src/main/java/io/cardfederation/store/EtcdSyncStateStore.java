package io.cardfederation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfederation.exceptions.PersistenceException;
import io.cardfederation.models.CardSyncState;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * etcd-based implementation of SyncStateStore.
 * One key per record; values are the JSON form of {@link CardSyncState}.
 */
@Slf4j
public class EtcdSyncStateStore extends AbstractEtcdStore implements SyncStateStore {

    public EtcdSyncStateStore(Client etcdClient, String namespace, ObjectMapper objectMapper, long operationTimeoutSeconds) {
        super(etcdClient, namespace, objectMapper, operationTimeoutSeconds);
        log.info("EtcdSyncStateStore initialized for namespace: {}", namespace);
    }

    @Override
    public List<CardSyncState> list() throws PersistenceException {
        log.debug("Listing sync states from etcd");
        GetResponse response;
        try {
            response = executeEtcdPrefixQuery(pathResolver.getSyncStatesPrefix(namespace));
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to list sync states from etcd: {}", e.getMessage(), e);
            throw new PersistenceException("Failed to list sync states", e);
        }

        List<CardSyncState> states = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            String json = kv.getValue().toString(StandardCharsets.UTF_8);
            try {
                states.add(objectMapper.readValue(json, CardSyncState.class));
            } catch (Exception e) {
                // one unreadable record must not hide the others
                log.warn("Skipping unreadable sync state at {}: {}",
                        kv.getKey().toString(StandardCharsets.UTF_8), e.getMessage());
            }
        }
        log.debug("Retrieved {} sync states from etcd", states.size());
        return states;
    }

    @Override
    public Optional<CardSyncState> get(String federatedId) throws PersistenceException {
        requireFederatedId(federatedId);
        try {
            Optional<String> json = executeEtcdGet(pathResolver.getSyncStatePath(namespace, federatedId));
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), CardSyncState.class));
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to get sync state {} from etcd: {}", federatedId, e.getMessage(), e);
            throw new PersistenceException("Failed to get sync state " + federatedId, e);
        }
    }

    @Override
    public void set(CardSyncState state) throws PersistenceException {
        requireFederatedId(state != null ? state.getFederatedId() : null);
        try {
            String json = objectMapper.writeValueAsString(state);
            executeEtcdPut(pathResolver.getSyncStatePath(namespace, state.getFederatedId()), json);
            log.debug("Stored sync state {} with platforms {}", state.getFederatedId(), state.getPlatformIds().keySet());
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to store sync state {} in etcd: {}", state.getFederatedId(), e.getMessage(), e);
            throw new PersistenceException("Failed to store sync state " + state.getFederatedId(), e);
        }
    }

    @Override
    public void delete(String federatedId) throws PersistenceException {
        requireFederatedId(federatedId);
        try {
            executeEtcdDelete(pathResolver.getSyncStatePath(namespace, federatedId));
            log.debug("Deleted sync state {}", federatedId);
        } catch (Exception e) {
            restoreInterrupt(e);
            log.error("Failed to delete sync state {} from etcd: {}", federatedId, e.getMessage(), e);
            throw new PersistenceException("Failed to delete sync state " + federatedId, e);
        }
    }

    private static void requireFederatedId(String federatedId) {
        if (federatedId == null || federatedId.isBlank()) {
            throw new IllegalArgumentException("Federated id cannot be null or empty");
        }
    }
}
