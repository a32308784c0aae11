package tech.tasktracker.backend.consumer;

import java.time.Duration;

public interface QueueConsumer {

    /**
     * Starts polling. Does nothing and returns false when the queue client is
     * disabled or the consumer is already running.
     */
    boolean start();

    /**
     * Requests cancellation and waits up to {@code grace} for the polling loop to exit.
     * Returns regardless once the grace period has passed.
     *
     * @return true if the loop exited within the grace period
     */
    boolean stop(Duration grace);

    /**
     * Returns the queue name being consumed
     */
    String getQueueIdentifier();

    ConsumerState getState();

    /**
     * Returns true if the consumer has fully stopped (polling thread terminated)
     */
    boolean isFullyStopped();

    /**
     * Returns the timestamp (milliseconds since epoch) of the last poll attempt.
     * Returns 0 if consumer has never polled.
     */
    long getLastPollTime();

    /**
     * Returns true if the consumer is running and has polled recently.
     */
    boolean isHealthy();
}
