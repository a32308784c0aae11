package tech.tasktracker.queue;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Queue client used when no credentials are configured.
 */
public class DisabledQueueClient implements QueueClient {

    private static final Logger LOG = Logger.getLogger(DisabledQueueClient.class);

    @Override
    public String send(String queueName, Object body, int delaySeconds, Map<String, ?> attributes) {
        throw new QueueUnavailableException("Message queue not configured");
    }

    @Override
    public List<QueueMessage> receive(String queueName, int maxMessages, int waitTimeSeconds) {
        LOG.warn("Message queue not enabled - nothing to receive");
        return List.of();
    }

    @Override
    public boolean delete(String queueName, String receipt) {
        return false;
    }

    @Override
    public QueueStats stats(String queueName) {
        return QueueStats.disabled(queueName);
    }

    @Override
    public QueueMode getMode() {
        return QueueMode.DISABLED;
    }
}
