package tech.tasktracker.queue;

/**
 * Operating mode of a {@link QueueClient}, fixed at construction.
 */
public enum QueueMode {
    /**
     * Talks to the remote queue backend.
     */
    ONLINE,

    /**
     * Simulates queue operations without network calls.
     * Sends produce reproducible IDs and nothing is ever received.
     */
    OFFLINE,

    /**
     * Credentials are missing; sends fail and receives return nothing.
     */
    DISABLED
}
