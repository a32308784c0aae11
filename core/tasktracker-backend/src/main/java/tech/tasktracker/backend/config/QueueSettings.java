package tech.tasktracker.backend.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Message queue connection settings.
 * Without credentials the queue client starts disabled; the application still runs.
 */
@ConfigMapping(prefix = "queue")
public interface QueueSettings {

    /**
     * Static access key ID of the service account.
     */
    Optional<String> accessKeyId();

    /**
     * Static secret access key of the service account.
     */
    Optional<String> secretAccessKey();

    /**
     * Queue URL prefix. Queue URLs are built as {@code {prefix}/{queueName}}.
     */
    @WithDefault("https://message-queue.api.cloud.yandex.net/b1g1qglub2qdq4p5ibol/g6000000a3u94706n1")
    String prefix();

    /**
     * Queue used by the consumer and by sends that do not name one.
     */
    @WithDefault("task-tracker-queue")
    String defaultQueue();

    @WithDefault("ru-central1")
    String region();

    @WithDefault("https://message-queue.api.cloud.yandex.net")
    String endpoint();

    /**
     * Simulate the queue without network calls.
     */
    @WithDefault("false")
    boolean offline();
}
