package tech.tasktracker.queue;

/**
 * Backend or network failure while talking to the queue.
 */
public class QueueTransportException extends RuntimeException {

    private final String queueName;

    public QueueTransportException(String queueName, String message, Throwable cause) {
        super(message, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
