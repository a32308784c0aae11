package tech.tasktracker.backend.metrics;

import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * Reads process figures from the platform MXBeans.
 * Every reading is isolated: a failing bean yields 0 for its value only.
 */
public class SystemMetricsProbe {

    private static final Logger LOG = Logger.getLogger(SystemMetricsProbe.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final Clock clock;
    private final long startNanos = System.nanoTime();

    public SystemMetricsProbe(Clock clock) {
        this.clock = clock;
    }

    public SystemMetrics sample() {
        return new SystemMetrics(
            uptimeSeconds(),
            cpuPercent(),
            memoryMb(),
            threadCount(),
            clock.instant()
        );
    }

    double uptimeSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    double cpuPercent() {
        try {
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
                double load = sunOs.getProcessCpuLoad();
                return load < 0 ? 0 : load * 100.0;
            }
        } catch (Exception e) {
            LOG.debugf(e, "Process CPU load not available");
        }
        return 0;
    }

    double memoryMb() {
        try {
            MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
            long used = memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
            return used / BYTES_PER_MB;
        } catch (Exception e) {
            LOG.debugf(e, "Memory usage not available");
            return 0;
        }
    }

    int threadCount() {
        try {
            return ManagementFactory.getThreadMXBean().getThreadCount();
        } catch (Exception e) {
            LOG.debugf(e, "Thread count not available");
            return 0;
        }
    }
}
