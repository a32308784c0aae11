package tech.tasktracker.backend.dispatch;

public enum DispatchResult {
    /**
     * A handler accepted the message.
     */
    HANDLED,

    /**
     * No handler for the type tag; the message is discarded.
     */
    DROPPED
}
