package tech.tasktracker.backend.metrics;

import java.util.List;

/**
 * Names of the counters every snapshot reports, even before their first increment.
 */
public final class MetricNames {

    public static final String REQUESTS_TOTAL = "requests_total";
    public static final String REQUESTS_SUCCESS = "requests_success";
    public static final String REQUESTS_ERROR = "requests_error";
    public static final String QUEUE_MESSAGES_SENT = "queue_messages_sent";
    public static final String QUEUE_MESSAGES_PROCESSED = "queue_messages_processed";
    public static final String QUEUE_MESSAGES_FAILED = "queue_messages_failed";
    public static final String QUEUE_MESSAGES_DROPPED = "queue_messages_dropped";
    public static final String DB_OPERATIONS = "db_operations";

    public static final List<String> KNOWN_COUNTERS = List.of(
        REQUESTS_TOTAL,
        REQUESTS_SUCCESS,
        REQUESTS_ERROR,
        QUEUE_MESSAGES_SENT,
        QUEUE_MESSAGES_PROCESSED,
        QUEUE_MESSAGES_FAILED,
        QUEUE_MESSAGES_DROPPED,
        DB_OPERATIONS
    );

    private MetricNames() {
    }
}
