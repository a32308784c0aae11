package tech.tasktracker.backend.metrics;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operational counters and the response time accumulator.
 *
 * <p>One lock guards all counters and the accumulator together. A request is recorded
 * by {@link #recordRequest(boolean, double)} in one locked update, so a snapshot never
 * sees it counted in {@code requests_total} but not yet classified or timed.
 * Counters only grow and saturate at {@link Long#MAX_VALUE}; {@link #reset()} is the
 * single exception.
 */
@ApplicationScoped
public class MetricsStore {

    private static final Logger LOG = Logger.getLogger(MetricsStore.class);
    private static final String HEALTHY = "healthy";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> counters = new TreeMap<>();
    private double responseTimeSum;
    private long responseTimeCount;

    private final Clock clock;
    private final SystemMetricsProbe systemProbe;

    @Inject
    public MetricsStore(Clock clock) {
        this(clock, new SystemMetricsProbe(clock));
    }

    public MetricsStore(Clock clock, SystemMetricsProbe systemProbe) {
        this.clock = clock;
        this.systemProbe = systemProbe;
        MetricNames.KNOWN_COUNTERS.forEach(name -> counters.put(name, 0L));
    }

    public void increment(String name) {
        increment(name, 1);
    }

    /**
     * Add {@code delta} to the named counter, creating it at zero if unseen.
     *
     * @throws IllegalArgumentException if delta is negative
     */
    public void increment(String name, long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Counter delta must not be negative: " + delta);
        }
        lock.lock();
        try {
            counters.merge(name, delta, MetricsStore::saturatedAdd);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record one finished HTTP request: total, success or error, and its duration.
     */
    public void recordRequest(boolean success, double seconds) {
        lock.lock();
        try {
            counters.merge(MetricNames.REQUESTS_TOTAL, 1L, MetricsStore::saturatedAdd);
            counters.merge(success ? MetricNames.REQUESTS_SUCCESS : MetricNames.REQUESTS_ERROR, 1L,
                MetricsStore::saturatedAdd);
            responseTimeSum += seconds;
            responseTimeCount++;
        } finally {
            lock.unlock();
        }
    }

    public void recordDuration(double seconds) {
        lock.lock();
        try {
            responseTimeSum += seconds;
            responseTimeCount++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current value of one counter, 0 if unseen.
     */
    public long counter(String name) {
        lock.lock();
        try {
            return counters.getOrDefault(name, 0L);
        } finally {
            lock.unlock();
        }
    }

    public ApplicationMetrics snapshotApplication() {
        Map<String, Long> copy;
        double sum;
        long count;
        lock.lock();
        try {
            copy = new TreeMap<>(counters);
            sum = responseTimeSum;
            count = responseTimeCount;
        } finally {
            lock.unlock();
        }

        long total = copy.getOrDefault(MetricNames.REQUESTS_TOTAL, 0L);
        long success = copy.getOrDefault(MetricNames.REQUESTS_SUCCESS, 0L);
        long error = copy.getOrDefault(MetricNames.REQUESTS_ERROR, 0L);

        return new ApplicationMetrics(
            copy,
            sum,
            count,
            count > 0 ? sum / count : 0.0,
            total > 0 ? (double) success / total * 100.0 : 0.0,
            total > 0 ? (double) error / total * 100.0 : 0.0,
            clock.instant()
        );
    }

    /**
     * Process figures; never fails.
     */
    public SystemMetrics snapshotSystem() {
        return systemProbe.sample();
    }

    public MetricsSnapshot snapshotAll() {
        return new MetricsSnapshot(snapshotApplication(), snapshotSystem(), HEALTHY, clock.instant());
    }

    /**
     * Zero every counter, including ones created at runtime, and the accumulator.
     */
    public void reset() {
        lock.lock();
        try {
            counters.replaceAll((name, value) -> 0L);
            responseTimeSum = 0.0;
            responseTimeCount = 0;
        } finally {
            lock.unlock();
        }
        LOG.info("Metrics reset");
    }

    // Both operands are non-negative, so a negative sum means overflow
    private static long saturatedAdd(long current, long delta) {
        long sum = current + delta;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
