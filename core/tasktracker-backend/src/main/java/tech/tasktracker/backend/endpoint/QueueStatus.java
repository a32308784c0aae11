package tech.tasktracker.backend.endpoint;

import tech.tasktracker.backend.consumer.ConsumerState;
import tech.tasktracker.queue.QueueMode;

public record QueueStatus(
    boolean enabled,
    QueueMode mode,
    String queueName,
    ConsumerState consumerState,
    boolean consumerHealthy,
    long lastPollTime
) {
}
