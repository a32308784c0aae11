package tech.tasktracker.queue.sqs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;
import tech.tasktracker.queue.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueueClient} backed by an SQS-compatible API (Yandex Message Queue).
 */
public class SqsQueueClient implements QueueClient {

    private static final Logger LOG = Logger.getLogger(SqsQueueClient.class);
    private static final int VISIBILITY_TIMEOUT_SECONDS = 30;

    private final SqsClient sqsClient;
    private final QueueClientConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SqsQueueClient(SqsClient sqsClient, QueueClientConfig config, ObjectMapper objectMapper, Clock clock) {
        this.sqsClient = sqsClient;
        this.config = config;
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

        try {
            SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(config.queueUrl(queueName))
                .messageBody(payload)
                .delaySeconds(delaySeconds)
                .messageAttributes(SqsMessageAttributes.prepare(attributes, clock))
                .build();

            SendMessageResponse response = sqsClient.sendMessage(request);
            LOG.infof("Message sent to queue [%s], messageId: %s", queueName, response.messageId());
            return response.messageId();

        } catch (SdkException e) {
            LOG.errorf(e, "Failed to send message to queue [%s]", queueName);
            throw new QueueTransportException(queueName, "Failed to send message to queue " + queueName, e);
        }
    }

    @Override
    public List<QueueMessage> receive(String queueName, int maxMessages, int waitTimeSeconds) {
        try {
            // Long poll plus a buffer, so the SDK timeout never cuts a normal empty poll short
            AwsRequestOverrideConfiguration overrideConfig = AwsRequestOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofSeconds(waitTimeSeconds + 5L))
                .build();

            ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(config.queueUrl(queueName))
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitTimeSeconds)
                .messageAttributeNames("All")
                .visibilityTimeout(VISIBILITY_TIMEOUT_SECONDS)
                .overrideConfiguration(overrideConfig)
                .build();

            ReceiveMessageResponse response = sqsClient.receiveMessage(request);

            List<QueueMessage> messages = new ArrayList<>(response.messages().size());
            for (Message msg : response.messages()) {
                messages.add(new QueueMessage(
                    msg.messageId(),
                    MessageBody.decode(msg.body(), objectMapper),
                    msg.receiptHandle(),
                    toStringAttributes(msg.messageAttributes())
                ));
            }

            if (!messages.isEmpty()) {
                LOG.infof("Received %d messages from queue [%s]", messages.size(), queueName);
            }
            return messages;

        } catch (Exception e) {
            LOG.errorf(e, "Failed to receive messages from queue [%s]", queueName);
            return List.of();
        }
    }

    @Override
    public boolean delete(String queueName, String receipt) {
        try {
            DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(config.queueUrl(queueName))
                .receiptHandle(receipt)
                .build();

            sqsClient.deleteMessage(request);
            LOG.debugf("Message deleted from queue [%s]", queueName);
            return true;

        } catch (ReceiptHandleIsInvalidException e) {
            LOG.debugf("Receipt handle for queue [%s] is no longer valid - treating delete as done", queueName);
            return true;
        } catch (SqsException e) {
            if (isReceiptHandleExpired(e)) {
                LOG.debugf("Receipt handle for queue [%s] has expired - treating delete as done", queueName);
                return true;
            }
            LOG.errorf(e, "Failed to delete message from queue [%s]", queueName);
            return false;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to delete message from queue [%s]", queueName);
            return false;
        }
    }

    @Override
    public QueueStats stats(String queueName) {
        try {
            GetQueueAttributesRequest request = GetQueueAttributesRequest.builder()
                .queueUrl(config.queueUrl(queueName))
                .attributeNames(
                    QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES,
                    QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE,
                    QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED,
                    QueueAttributeName.CREATED_TIMESTAMP,
                    QueueAttributeName.LAST_MODIFIED_TIMESTAMP
                )
                .build();

            Map<QueueAttributeName, String> attributes = sqsClient.getQueueAttributes(request).attributes();

            return new QueueStats(
                queueName,
                true,
                QueueMode.ONLINE,
                parseLong(attributes.get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)),
                parseLong(attributes.get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE)),
                parseLong(attributes.get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED)),
                parseTimestamp(attributes.get(QueueAttributeName.CREATED_TIMESTAMP)),
                parseTimestamp(attributes.get(QueueAttributeName.LAST_MODIFIED_TIMESTAMP))
            );

        } catch (Exception e) {
            LOG.errorf(e, "Failed to get queue stats for [%s]", queueName);
            return QueueStats.empty(queueName, QueueMode.ONLINE);
        }
    }

    @Override
    public QueueMode getMode() {
        return QueueMode.ONLINE;
    }

    @Override
    public void close() {
        sqsClient.close();
    }

    private static Map<String, String> toStringAttributes(Map<String, MessageAttributeValue> attributes) {
        Map<String, String> result = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (value.stringValue() != null) {
                result.put(key, value.stringValue());
            }
        });
        return result;
    }

    private static long parseLong(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Instant parseTimestamp(String epochSeconds) {
        if (epochSeconds == null || epochSeconds.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(epochSeconds));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isReceiptHandleExpired(SqsException e) {
        return e.getMessage() != null && e.getMessage().contains("receipt handle has expired");
    }
}
