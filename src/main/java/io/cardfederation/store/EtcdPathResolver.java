package io.cardfederation.store;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static io.cardfederation.config.Constants.*;

/**
 * Centralized etcd path resolver for federation keys.
 * Stateless singleton - the namespace is passed to every call.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    /**
     * Root of all keys of a namespace
     * Pattern: /<namespace>
     */
    public String getNamespaceRoot(String namespace) {
        return PATH_DELIMITER + namespace;
    }

    // =================================================================
    // SYNC STATE PATHS
    // =================================================================

    /**
     * Prefix for all sync state records
     * Pattern: /<namespace>/sync-states
     */
    public String getSyncStatesPrefix(String namespace) {
        return getNamespaceRoot(namespace) + PATH_DELIMITER + PATH_SYNC_STATES;
    }

    /**
     * Path of one sync state record. Federated ids are URLs, so they are encoded into a single segment.
     * Pattern: /<namespace>/sync-states/<base64url(federated-id)>
     */
    public String getSyncStatePath(String namespace, String federatedId) {
        return getSyncStatesPrefix(namespace) + PATH_DELIMITER + encodeSegment(federatedId);
    }

    // =================================================================
    // SETTINGS PATHS
    // =================================================================

    /**
     * Path of the settings snapshot
     * Pattern: /<namespace>/settings
     */
    public String getSettingsPath(String namespace) {
        return getNamespaceRoot(namespace) + PATH_DELIMITER + PATH_SETTINGS;
    }

    public String encodeSegment(String value) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    public String decodeSegment(String segment) {
        return new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8);
    }
}
