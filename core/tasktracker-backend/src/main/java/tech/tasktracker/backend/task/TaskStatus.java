package tech.tasktracker.backend.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    DONE("done");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a status, accepting either the wire value or the enum name in any case.
     *
     * @throws IllegalArgumentException for unknown statuses
     */
    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TaskStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
