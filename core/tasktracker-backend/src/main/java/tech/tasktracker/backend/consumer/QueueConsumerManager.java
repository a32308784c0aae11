package tech.tasktracker.backend.consumer;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.config.ConsumerSettings;
import tech.tasktracker.backend.config.QueueSettings;
import tech.tasktracker.backend.dispatch.MessageDispatcher;
import tech.tasktracker.backend.metrics.MetricsStore;
import tech.tasktracker.queue.QueueClient;

import java.util.Optional;

/**
 * Owns the background consumer: starts it with the application and stops it on
 * shutdown, waiting at most the configured grace period.
 */
@ApplicationScoped
public class QueueConsumerManager {

    private static final Logger LOG = Logger.getLogger(QueueConsumerManager.class);

    @Inject
    QueueClient queueClient;

    @Inject
    MessageDispatcher dispatcher;

    @Inject
    MetricsStore metrics;

    @Inject
    QueueSettings queueSettings;

    @Inject
    ConsumerSettings consumerSettings;

    private volatile QueueConsumer consumer;

    void onStartup(@Observes StartupEvent event) {
        if (!consumerSettings.enabled()) {
            LOG.info("Queue consumer disabled by configuration");
            return;
        }
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized boolean start() {
        if (consumer == null) {
            consumer = new TaskQueueConsumer(
                queueClient,
                dispatcher,
                metrics,
                consumerSettings.queueName().orElse(queueSettings.defaultQueue()),
                consumerSettings.maxMessages(),
                consumerSettings.waitTimeSeconds(),
                consumerSettings.idleBackoff(),
                consumerSettings.errorBackoff()
            );
        }
        return consumer.start();
    }

    public synchronized boolean stop() {
        if (consumer == null) {
            return true;
        }
        LOG.info("Queue consumer shutting down...");
        return consumer.stop(consumerSettings.shutdownGrace());
    }

    public Optional<QueueConsumer> getConsumer() {
        return Optional.ofNullable(consumer);
    }

    public ConsumerState getState() {
        QueueConsumer current = consumer;
        return current != null ? current.getState() : ConsumerState.STOPPED;
    }
}
