package tech.tasktracker.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.queue.QueueClient;
import tech.tasktracker.queue.QueueClientConfig;
import tech.tasktracker.queue.QueueClientFactory;

import java.time.Clock;

/**
 * Builds the single queue client shared by the consumer and the HTTP endpoints.
 */
@ApplicationScoped
public class QueueClientProducer {

    private static final Logger LOG = Logger.getLogger(QueueClientProducer.class);

    @Inject
    QueueSettings queueSettings;

    @Inject
    ObjectMapper objectMapper;

    @Produces
    @ApplicationScoped
    QueueClient queueClient(Clock clock) {
        QueueClientConfig config = new QueueClientConfig(
            queueSettings.accessKeyId(),
            queueSettings.secretAccessKey(),
            queueSettings.prefix(),
            queueSettings.region(),
            queueSettings.endpoint(),
            queueSettings.offline()
        );

        QueueClient client = new QueueClientFactory(objectMapper, clock).create(config);
        LOG.infof("Queue client ready: mode=%s, defaultQueue=%s", client.getMode(), queueSettings.defaultQueue());
        return client;
    }

    void closeQueueClient(@Disposes QueueClient client) {
        client.close();
    }
}
