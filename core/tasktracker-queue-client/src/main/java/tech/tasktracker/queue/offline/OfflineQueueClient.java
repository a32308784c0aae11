package tech.tasktracker.queue.offline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.tasktracker.queue.QueueClient;
import tech.tasktracker.queue.QueueMessage;
import tech.tasktracker.queue.QueueMode;
import tech.tasktracker.queue.QueueStats;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Queue client that never touches the network.
 * Send IDs are derived from the body and the send time, so they are reproducible
 * under a fixed clock. Nothing sent is ever delivered back.
 */
public class OfflineQueueClient implements QueueClient {

    private static final Logger LOG = Logger.getLogger(OfflineQueueClient.class);
    private static final int HASH_HEX_LENGTH = 16;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OfflineQueueClient(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String send(String queueName, Object body, int delaySeconds, Map<String, ?> attributes) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message body is not serializable: " + e.getOriginalMessage(), e);
        }

        long timestamp = clock.instant().getEpochSecond();
        String messageId = "offline-msg-" + timestamp + "-" + hash(payload + ":" + timestamp);
        LOG.infof("[OFFLINE] Message for queue [%s] accepted, ID: %s", queueName, messageId);
        return messageId;
    }

    @Override
    public List<QueueMessage> receive(String queueName, int maxMessages, int waitTimeSeconds) {
        LOG.debugf("[OFFLINE] Receive from queue [%s] - nothing to deliver", queueName);
        return List.of();
    }

    @Override
    public boolean delete(String queueName, String receipt) {
        LOG.debugf("[OFFLINE] Delete from queue [%s]", queueName);
        return true;
    }

    @Override
    public QueueStats stats(String queueName) {
        return QueueStats.empty(queueName, QueueMode.OFFLINE);
    }

    @Override
    public QueueMode getMode() {
        return QueueMode.OFFLINE;
    }

    private static String hash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
