package tech.tasktracker.backend.dispatch.handler;

import com.fasterxml.jackson.databind.JsonNode;
import tech.tasktracker.backend.dispatch.InvalidPayloadException;
import tech.tasktracker.backend.task.TaskStatus;

final class Payloads {

    private Payloads() {
    }

    static String requiredText(JsonNode data, String field) {
        String value = optionalText(data, field);
        if (value == null || value.isBlank()) {
            throw new InvalidPayloadException("Field [" + field + "] is required");
        }
        return value;
    }

    static String optionalText(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new InvalidPayloadException("Field [" + field + "] must be a string");
        }
        return node.asText();
    }

    static long requiredId(JsonNode data) {
        JsonNode node = data.get("id");
        if (node == null || !node.canConvertToLong()) {
            throw new InvalidPayloadException("Field [id] must be an integer");
        }
        return node.asLong();
    }

    static TaskStatus optionalStatus(JsonNode data) {
        String value = optionalText(data, "status");
        if (value == null) {
            return null;
        }
        try {
            return TaskStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(e.getMessage());
        }
    }

    static JsonNode object(JsonNode data) {
        if (!data.isObject()) {
            throw new InvalidPayloadException("Field [data] must be an object");
        }
        return data;
    }
}
