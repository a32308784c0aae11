package tech.tasktracker.backend.dispatch;

/**
 * Message data does not carry the fields its type requires.
 */
public class InvalidPayloadException extends RuntimeException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
