package tech.tasktracker.backend.metrics;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of the application counters and derived rates.
 */
@Schema(description = "Application counters and derived rates")
public record ApplicationMetrics(
    @Schema(description = "Counter values by name", example = "{\"requests_total\": 12}")
    Map<String, Long> counters,

    @Schema(description = "Sum of recorded response times in seconds")
    double responseTimeSum,

    @Schema(description = "Number of recorded response times")
    long responseTimeCount,

    @Schema(description = "Average response time in seconds, 0 when nothing was recorded")
    double responseTimeAvg,

    @Schema(description = "requests_success / requests_total * 100, 0 when there were no requests")
    double successRate,

    @Schema(description = "requests_error / requests_total * 100, 0 when there were no requests")
    double errorRate,

    Instant timestamp
) {
    public ApplicationMetrics {
        counters = Collections.unmodifiableMap(new TreeMap<>(counters));
    }

    /**
     * Value of a counter, 0 if it was never incremented.
     */
    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }
}
