package tech.tasktracker.backend.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import tech.tasktracker.queue.MessageBody;

/**
 * Typed view of a message body: {@code {"type": "...", "data": {...}}}.
 * Bodies without a usable type tag, including raw text, get the {@link #UNKNOWN_TYPE} tag.
 *
 * @param type Type tag used for routing
 * @param data Payload; {@link MissingNode} when absent
 */
public record TaskEnvelope(String type, JsonNode data) {

    public static final String UNKNOWN_TYPE = "unknown";

    public TaskEnvelope {
        data = data == null ? MissingNode.getInstance() : data;
    }

    public static TaskEnvelope from(MessageBody body) {
        if (body instanceof MessageBody.Structured structured && structured.json().isObject()) {
            JsonNode json = structured.json();
            JsonNode type = json.get("type");
            String tag = type != null && type.isTextual() && !type.asText().isBlank()
                ? type.asText()
                : UNKNOWN_TYPE;
            return new TaskEnvelope(tag, json.path("data"));
        }
        return new TaskEnvelope(UNKNOWN_TYPE, MissingNode.getInstance());
    }

    public boolean isUnknown() {
        return UNKNOWN_TYPE.equals(type);
    }
}
