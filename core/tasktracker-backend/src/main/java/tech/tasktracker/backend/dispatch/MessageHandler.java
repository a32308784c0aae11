package tech.tasktracker.backend.dispatch;

/**
 * Synchronous handler for one message type.
 * Implementations are discovered as CDI beans; each type may have one handler only.
 */
public interface MessageHandler {

    /**
     * Type tag this handler accepts.
     */
    String type();

    /**
     * Handle one message. Any exception marks the message as failed; it stays on
     * the queue and is redelivered after its visibility timeout.
     */
    void handle(TaskEnvelope envelope) throws Exception;
}
