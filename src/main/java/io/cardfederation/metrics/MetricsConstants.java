package io.cardfederation.metrics;

/**
 * Constants for metrics names and tags used by the federation service.
 */
public class MetricsConstants {
    public final static String SYNC_OPERATIONS_METRIC_NAME = "federation_sync_operations_total";
    public final static String POLL_METRIC_NAME = "federation_poll_total";
    public final static String POLL_DURATION_METRIC_NAME = "federation_poll_duration";
    public final static String CONNECTION_CHECKS_METRIC_NAME = "federation_connection_checks_total";
    public final static String TRACKED_SYNC_STATES_METRIC_NAME = "federation_tracked_sync_states";

    public final static String PLATFORM_TAG = "platform";
    public final static String OPERATION_TAG = "operation";
    public final static String OUTCOME_TAG = "outcome";
    public final static String INSTANCE_TAG = "instance";

    public final static String OUTCOME_SUCCESS = "success";
    public final static String OUTCOME_SKIPPED = "skipped";
    public final static String OUTCOME_FAILURE = "failure";
    public final static String OUTCOME_CANCELLED = "cancelled";
    public final static String OUTCOME_CONNECTED = "connected";
    public final static String OUTCOME_UNREACHABLE = "unreachable";

    private MetricsConstants() {}
}
