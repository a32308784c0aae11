package tech.tasktracker.queue;

import java.util.List;
import java.util.Map;

/**
 * Abstraction over the managed message queue used by the task tracker.
 * Implementations exist for the remote SQS-compatible backend, a deterministic
 * offline mode and a disabled (unconfigured) mode.
 */
public interface QueueClient {

    /**
     * Send a message to the named queue.
     *
     * @param queueName  Queue name, appended to the configured prefix
     * @param body       Payload, serialized to JSON
     * @param delaySeconds Delivery delay in seconds
     * @param attributes Caller attributes, merged over the standard ones
     * @return Message ID assigned by the backend
     * @throws QueueUnavailableException if the client was never configured
     * @throws QueueTransportException   if the backend rejects the call or cannot be reached
     */
    String send(String queueName, Object body, int delaySeconds, Map<String, ?> attributes);

    default String send(String queueName, Object body) {
        return send(queueName, body, 0, Map.of());
    }

    /**
     * Long-poll the named queue. Returns an empty list on timeout and on any
     * transport failure; never throws.
     */
    List<QueueMessage> receive(String queueName, int maxMessages, int waitTimeSeconds);

    /**
     * Delete one delivery. Deleting an already deleted or expired receipt counts as success.
     */
    boolean delete(String queueName, String receipt);

    /**
     * Best-effort queue statistics.
     */
    QueueStats stats(String queueName);

    QueueMode getMode();

    default boolean isEnabled() {
        return getMode() != QueueMode.DISABLED;
    }

    /**
     * Close any connections. Called on shutdown.
     */
    default void close() {
    }
}
