package tech.tasktracker.queue;

/**
 * Thrown when a send is attempted on a queue client that was never configured.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message) {
        super(message);
    }
}
