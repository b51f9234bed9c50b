package io.cardfederation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.cardfederation.config.Constants.PATH_DELIMITER;

/**
 * Shared etcd plumbing for the federation stores: single-key get/put/delete and prefix scans,
 * each bounded by the operation timeout.
 */
abstract class AbstractEtcdStore {

    protected final KV kvClient;
    protected final ObjectMapper objectMapper;
    protected final EtcdPathResolver pathResolver;
    protected final String namespace;
    protected final long operationTimeoutSeconds;

    protected AbstractEtcdStore(Client etcdClient, String namespace, ObjectMapper objectMapper, long operationTimeoutSeconds) {
        this.kvClient = etcdClient.getKVClient();
        this.namespace = namespace;
        this.objectMapper = objectMapper;
        this.operationTimeoutSeconds = operationTimeoutSeconds;
        this.pathResolver = EtcdPathResolver.getInstance();
    }

    /**
     * Executes etcd prefix query to retrieve all keys below the given prefix
     */
    protected GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, StandardCharsets.UTF_8);
        return kvClient.get(
                prefixBytes,
                GetOption.builder().isPrefix(true).build()
        ).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd get operation for a single key
     */
    protected Optional<String> executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        GetResponse response = kvClient.get(keyBytes).get(operationTimeoutSeconds, TimeUnit.SECONDS);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0).getValue().toString(StandardCharsets.UTF_8));
    }

    /**
     * Executes etcd put operation for a key-value pair
     */
    protected void executeEtcdPut(String key, String value) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, StandardCharsets.UTF_8);
        kvClient.put(keyBytes, valueBytes).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd delete operation for a key
     */
    protected void executeEtcdDelete(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        kvClient.delete(keyBytes).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    protected static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
