package tech.tasktracker.backend.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Background queue consumer settings.
 */
@ConfigMapping(prefix = "consumer")
public interface ConsumerSettings {

    /**
     * Start the consumer on application startup.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Queue to consume. Defaults to {@code queue.default-queue}.
     */
    Optional<String> queueName();

    /**
     * Maximum messages per receive call (SQS allows 1-10).
     */
    @WithDefault("10")
    int maxMessages();

    /**
     * Long-poll wait per receive call.
     */
    @WithDefault("20")
    int waitTimeSeconds();

    /**
     * Pause between polls.
     */
    @WithDefault("1s")
    Duration idleBackoff();

    /**
     * Pause after a poll cycle failed.
     */
    @WithDefault("5s")
    Duration errorBackoff();

    /**
     * How long shutdown waits for the current cycle before giving up on it.
     */
    @WithDefault("10s")
    Duration shutdownGrace();
}
