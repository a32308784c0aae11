package tech.tasktracker.backend.endpoint;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Manual send request.
 *
 * @param queueName    Target queue; the default queue when absent
 * @param body         Message body, sent as JSON
 * @param delaySeconds Delivery delay; 0 when absent
 * @param attributes   Extra message attributes (strings, numbers, booleans)
 */
public record SendMessageRequest(
    String queueName,
    JsonNode body,
    Integer delaySeconds,
    Map<String, Object> attributes
) {
}
