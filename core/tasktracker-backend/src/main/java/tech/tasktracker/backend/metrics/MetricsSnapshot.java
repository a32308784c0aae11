package tech.tasktracker.backend.metrics;

import java.time.Instant;

public record MetricsSnapshot(
    ApplicationMetrics application,
    SystemMetrics system,
    String status,
    Instant timestamp
) {
}
