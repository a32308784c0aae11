package tech.tasktracker.queue;

import java.util.Map;

/**
 * A message delivered by the queue.
 *
 * @param id         Backend message ID
 * @param body       Decoded body, or the raw text when it is not valid JSON
 * @param receipt    Receipt handle required to delete this delivery
 * @param attributes Message attributes as strings
 */
public record QueueMessage(
    String id,
    MessageBody body,
    String receipt,
    Map<String, String> attributes
) {
    public QueueMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
