package tech.tasktracker.backend.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsStoreTest {

    private MetricsStore store;

    @BeforeEach
    void setUp() {
        store = new MetricsStore(Clock.systemUTC());
    }

    @Test
    void knownCountersStartAtZero() {
        ApplicationMetrics snapshot = store.snapshotApplication();

        for (String name : MetricNames.KNOWN_COUNTERS) {
            assertEquals(0L, snapshot.counters().get(name), name);
        }
        assertEquals(0.0, snapshot.successRate());
        assertEquals(0.0, snapshot.errorRate());
        assertEquals(0.0, snapshot.responseTimeAvg());
    }

    @Test
    void incrementCreatesUnseenCounters() {
        store.increment("cache_hits");
        store.increment("cache_hits", 4);

        assertEquals(5L, store.counter("cache_hits"));
        assertEquals(5L, store.snapshotApplication().counter("cache_hits"));
    }

    @Test
    void negativeDeltaIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.increment(MetricNames.REQUESTS_TOTAL, -1));
        assertEquals(0L, store.counter(MetricNames.REQUESTS_TOTAL));
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        int threads = 32;
        int perThread = 5_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                long delta = t % 3 + 1;
                futures.add(executor.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < perThread; i++) {
                        store.increment("stress", delta);
                        store.increment(MetricNames.REQUESTS_TOTAL);
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long expected = 0;
        for (int t = 0; t < threads; t++) {
            expected += (long) (t % 3 + 1) * perThread;
        }
        assertEquals(expected, store.counter("stress"));
        assertEquals((long) threads * perThread, store.counter(MetricNames.REQUESTS_TOTAL));
    }

    @Test
    void recordRequestUpdatesTotalClassificationAndDuration() {
        store.recordRequest(true, 0.25);
        store.recordRequest(false, 0.75);

        ApplicationMetrics snapshot = store.snapshotApplication();

        assertEquals(2L, snapshot.counter(MetricNames.REQUESTS_TOTAL));
        assertEquals(1L, snapshot.counter(MetricNames.REQUESTS_SUCCESS));
        assertEquals(1L, snapshot.counter(MetricNames.REQUESTS_ERROR));
        assertEquals(2, snapshot.responseTimeCount());
        assertEquals(0.5, snapshot.responseTimeAvg(), 1e-9);
    }

    @Test
    void snapshotsNeverSeeHalfRecordedRequests() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int w = 0; w < 3; w++) {
                writers.add(executor.submit(() -> {
                    for (int i = 0; i < 20_000; i++) {
                        store.recordRequest(i % 4 != 0, 0.001);
                    }
                }));
            }
            while (writers.stream().anyMatch(writer -> !writer.isDone())) {
                ApplicationMetrics snapshot = store.snapshotApplication();
                long total = snapshot.counter(MetricNames.REQUESTS_TOTAL);
                long classified = snapshot.counter(MetricNames.REQUESTS_SUCCESS) + snapshot.counter(MetricNames.REQUESTS_ERROR);
                assertEquals(total, classified);
                assertEquals(total, snapshot.responseTimeCount());
            }
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(60_000L, store.counter(MetricNames.REQUESTS_TOTAL));
    }

    @Test
    void countersSaturateInsteadOfOverflowing() {
        store.increment("big", Long.MAX_VALUE - 1);
        store.increment("big", 5);
        store.increment("big");

        assertEquals(Long.MAX_VALUE, store.counter("big"));
    }

    @Test
    void snapshotCountersAreSortedByName() {
        store.increment("zeta");
        store.increment("alpha");

        List<String> names = new ArrayList<>(store.snapshotApplication().counters().keySet());
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(null);

        assertEquals(sorted, names);
        assertEquals("alpha", names.get(0));
    }

    @Test
    void ratesAddUpToHundredWhenEveryRequestIsClassified() {
        store.increment(MetricNames.REQUESTS_TOTAL, 7);
        store.increment(MetricNames.REQUESTS_SUCCESS, 5);
        store.increment(MetricNames.REQUESTS_ERROR, 2);

        ApplicationMetrics snapshot = store.snapshotApplication();

        assertEquals(5.0 / 7 * 100, snapshot.successRate(), 1e-9);
        assertEquals(2.0 / 7 * 100, snapshot.errorRate(), 1e-9);
        assertEquals(100.0, snapshot.successRate() + snapshot.errorRate(), 1e-9);
    }

    @Test
    void averageResponseTimeIsSumOverCount() {
        store.recordDuration(0.2);
        store.recordDuration(0.4);

        ApplicationMetrics snapshot = store.snapshotApplication();

        assertEquals(0.6, snapshot.responseTimeSum(), 1e-9);
        assertEquals(2, snapshot.responseTimeCount());
        assertEquals(0.3, snapshot.responseTimeAvg(), 1e-9);
    }

    @Test
    void resetZeroesEverything() {
        store.increment(MetricNames.REQUESTS_TOTAL, 3);
        store.increment(MetricNames.REQUESTS_SUCCESS, 2);
        store.increment(MetricNames.REQUESTS_ERROR);
        store.increment("custom_counter", 9);
        store.recordDuration(1.5);

        store.reset();
        ApplicationMetrics snapshot = store.snapshotApplication();

        snapshot.counters().forEach((name, value) -> assertEquals(0L, value, name));
        assertEquals(0L, snapshot.counter("custom_counter"));
        assertEquals(0.0, snapshot.successRate());
        assertEquals(0.0, snapshot.errorRate());
        assertEquals(0.0, snapshot.responseTimeAvg());
        assertEquals(0, snapshot.responseTimeCount());
    }

    @Test
    void snapshotIsACopy() {
        ApplicationMetrics before = store.snapshotApplication();
        store.increment(MetricNames.QUEUE_MESSAGES_SENT);

        assertEquals(0L, before.counter(MetricNames.QUEUE_MESSAGES_SENT));
        assertThrows(UnsupportedOperationException.class, () -> before.counters().put("x", 1L));
    }

    @Test
    void systemSnapshotReportsProcessFigures() {
        SystemMetrics system = store.snapshotSystem();

        assertTrue(system.uptimeSeconds() >= 0);
        assertTrue(system.cpuPercent() >= 0);
        assertTrue(system.memoryMb() > 0);
        assertTrue(system.threadCount() > 0);
        assertNotNull(system.timestamp());
    }

    @Test
    void snapshotAllReportsHealthy() {
        MetricsSnapshot all = store.snapshotAll();

        assertEquals("healthy", all.status());
        assertNotNull(all.application());
        assertNotNull(all.system());
    }
}
