package tech.tasktracker.backend.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.tasktracker.backend.consumer.ConsumerState;
import tech.tasktracker.backend.consumer.QueueConsumerManager;

/**
 * Publishes the store's counters and the consumer state to the Micrometer registry
 * ({@code /q/metrics}). Values are read from the store on every scrape.
 */
@Singleton
public class TaskTrackerMeterBinder implements MeterBinder {

    private static final String PREFIX = "tasktracker.";

    @Inject
    MetricsStore metricsStore;

    @Inject
    QueueConsumerManager consumerManager;

    @Override
    public void bindTo(MeterRegistry registry) {
        for (String counter : MetricNames.KNOWN_COUNTERS) {
            Gauge.builder(PREFIX + counter.replace('_', '.'), metricsStore, store -> store.counter(counter))
                .description("Task tracker counter " + counter)
                .register(registry);
        }

        Gauge.builder(PREFIX + "response.time.avg", metricsStore,
                store -> store.snapshotApplication().responseTimeAvg())
            .description("Average HTTP response time in seconds")
            .baseUnit("seconds")
            .register(registry);

        Gauge.builder(PREFIX + "consumer.running", consumerManager,
                manager -> manager.getState() == ConsumerState.RUNNING ? 1 : 0)
            .description("1 while the queue consumer is running")
            .register(registry);
    }
}
