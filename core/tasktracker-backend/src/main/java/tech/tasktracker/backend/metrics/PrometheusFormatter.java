package tech.tasktracker.backend.metrics;

import java.util.Locale;
import java.util.Map;

/**
 * Renders metrics snapshots in the Prometheus text exposition format.
 * Application figures carry {@code type="application"}, process figures {@code type="system"}.
 */
public final class PrometheusFormatter {

    private static final String APPLICATION = "application";
    private static final String SYSTEM = "system";

    private PrometheusFormatter() {
    }

    public static String format(ApplicationMetrics application, SystemMetrics system) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> e : application.counters().entrySet()) {
            appendGauge(sb, e.getKey(), APPLICATION, Long.toString(e.getValue()));
        }
        appendGauge(sb, "response_time_sum", APPLICATION, number(application.responseTimeSum()));
        appendGauge(sb, "response_time_count", APPLICATION, Long.toString(application.responseTimeCount()));
        appendGauge(sb, "response_time_avg", APPLICATION, number(application.responseTimeAvg()));
        appendGauge(sb, "success_rate", APPLICATION, number(application.successRate()));
        appendGauge(sb, "error_rate", APPLICATION, number(application.errorRate()));

        appendGauge(sb, "uptime_seconds", SYSTEM, number(system.uptimeSeconds()));
        appendGauge(sb, "cpu_percent", SYSTEM, number(system.cpuPercent()));
        appendGauge(sb, "memory_mb", SYSTEM, number(system.memoryMb()));
        appendGauge(sb, "thread_count", SYSTEM, Integer.toString(system.threadCount()));
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String type, String value) {
        String name = sanitize(metric);
        sb.append("# TYPE ").append(name).append(" gauge").append('\n');
        sb.append(name).append("{type=\"").append(type).append("\"} ").append(value).append('\n');
    }

    // Counter names are open-ended; keep them valid Prometheus identifiers
    private static String sanitize(String metric) {
        String name = metric.replaceAll("[^a-zA-Z0-9_:]", "_");
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            return "_" + name;
        }
        return name;
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
