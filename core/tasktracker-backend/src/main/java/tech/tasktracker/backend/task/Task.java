package tech.tasktracker.backend.task;

import java.time.Instant;

public record Task(
    long id,
    String title,
    String description,
    TaskStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    Task withChanges(String newTitle, String newDescription, TaskStatus newStatus, Instant now) {
        return new Task(
            id,
            newTitle != null ? newTitle : title,
            newDescription != null ? newDescription : description,
            newStatus != null ? newStatus : status,
            createdAt,
            now
        );
    }
}
