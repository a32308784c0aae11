package tech.tasktracker.backend.dispatch;

/**
 * A handler failed on one message.
 */
public class MessageHandlingException extends RuntimeException {

    private final String messageId;
    private final String type;

    public MessageHandlingException(String messageId, String type, Throwable cause) {
        super("Handler for type [" + type + "] failed on message [" + messageId + "]: " + cause.getMessage(), cause);
        this.messageId = messageId;
        this.type = type;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getType() {
        return type;
    }
}
