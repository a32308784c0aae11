package tech.tasktracker.backend.consumer;

/**
 * Lifecycle of a queue consumer.
 * {@code STOPPED -> RUNNING} on start, {@code RUNNING -> CANCELLING} on stop,
 * {@code CANCELLING -> STOPPED} once the current cycle has finished.
 */
public enum ConsumerState {
    STOPPED,
    RUNNING,
    CANCELLING
}
