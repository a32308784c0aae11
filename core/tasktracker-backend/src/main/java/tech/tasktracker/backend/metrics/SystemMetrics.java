package tech.tasktracker.backend.metrics;

import java.time.Instant;

/**
 * Process-level figures. Values the platform cannot supply are 0.
 */
public record SystemMetrics(
    double uptimeSeconds,
    double cpuPercent,
    double memoryMb,
    int threadCount,
    Instant timestamp
) {
}
