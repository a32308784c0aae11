package tech.tasktracker.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Body of a received message: either a decoded JSON tree or the raw text
 * when decoding failed.
 */
public sealed interface MessageBody permits MessageBody.Structured, MessageBody.Raw {

    /**
     * Body text exactly as delivered.
     */
    String text();

    record Structured(JsonNode json, String text) implements MessageBody {
    }

    record Raw(String text) implements MessageBody {
    }

    static MessageBody decode(String text, ObjectMapper mapper) {
        if (text == null) {
            return new Raw("");
        }
        try {
            JsonNode json = mapper.readTree(text);
            if (json == null || json.isMissingNode()) {
                return new Raw(text);
            }
            return new Structured(json, text);
        } catch (JsonProcessingException e) {
            return new Raw(text);
        }
    }
}
