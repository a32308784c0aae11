package tech.tasktracker.queue;

import java.time.Instant;

/**
 * Approximate statistics for a queue.
 *
 * @param queueName  Queue name
 * @param enabled    False when the client is not configured
 * @param mode       Mode of the client that produced these stats
 * @param available  Messages available for retrieval
 * @param inFlight   Messages received but not yet deleted (not visible)
 * @param delayed    Messages delayed and not yet available
 * @param createdAt  Queue creation time, null if unknown
 * @param modifiedAt Last modification of queue attributes, null if unknown
 */
public record QueueStats(
    String queueName,
    boolean enabled,
    QueueMode mode,
    long available,
    long inFlight,
    long delayed,
    Instant createdAt,
    Instant modifiedAt
) {
    public static QueueStats empty(String queueName, QueueMode mode) {
        return new QueueStats(queueName, mode != QueueMode.DISABLED, mode, 0, 0, 0, null, null);
    }

    public static QueueStats disabled(String queueName) {
        return empty(queueName, QueueMode.DISABLED);
    }
}
