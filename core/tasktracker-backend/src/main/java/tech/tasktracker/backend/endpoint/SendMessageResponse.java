package tech.tasktracker.backend.endpoint;

public record SendMessageResponse(String messageId, String queueName) {
}
