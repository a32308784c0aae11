package tech.tasktracker.backend.endpoint;

public record ErrorResponse(String error) {
}
