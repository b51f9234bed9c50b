package io.cardfederation.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_ETCD_NAMESPACE = "card-federation";
    public static final long DEFAULT_ETCD_OPERATION_TIMEOUT_SECONDS = 5L;
    public static final String DEFAULT_ORIGIN_URL = "http://localhost:3456";
    public static final long DEFAULT_CONNECT_TIMEOUT_SECONDS = 10L;
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_TASK_INTERVAL_SECONDS = 60L;
    public static final int DEFAULT_POLL_POOL_SIZE = 4;
    public static final int DEFAULT_SYNC_INTERVAL_MINUTES = 30;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_SYNC_STATES = "sync-states";
    public static final String PATH_SETTINGS = "settings";

    // Identity formats, appended to the origin URL
    public static final String FEDERATED_CARDS_SEGMENT = "/cards/";
    public static final String ACTOR_SUFFIX = "/user";

    // Federation endpoint layout
    public static final String SILLYTAVERN_FEDERATION_BASE = "/api/plugins/cforge/federation";
    public static final String FEDERATION_BASE = "/api/federation";
    public static final String ENDPOINT_OUTBOX = "/outbox";
    public static final String ENDPOINT_INBOX = "/inbox";
    public static final String ENDPOINT_ACTOR = "/actor";
    public static final String HEADER_API_KEY = "X-API-Key";
    public static final String HEADER_AUTHORIZATION = "Authorization";

    // Local catalog API
    public static final String CATALOG_CARDS_PATH = "/api/cards";

    // Task names
    public static final String TASK_POLL_PLATFORMS = "poll_platforms";
    public static final String TASK_PROBE_CONNECTIONS = "probe_connections";

    // Task statuses
    public static final String TASK_STATUS_COMPLETED = "COMPLETED";
    public static final String TASK_STATUS_FAILED = "FAILED";
    public static final String TASK_STATUS_SKIPPED = "SKIPPED";
}
