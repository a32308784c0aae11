package tech.tasktracker.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import tech.tasktracker.queue.offline.OfflineQueueClient;
import tech.tasktracker.queue.sqs.SqsQueueClient;

import java.net.URI;
import java.time.Clock;

/**
 * Factory for creating QueueClient instances based on configuration.
 * The mode is resolved once here and never changes for the returned client.
 */
public class QueueClientFactory {

    private static final Logger LOG = Logger.getLogger(QueueClientFactory.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public QueueClientFactory(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public QueueClient create(QueueClientConfig config) {
        return switch (config.mode()) {
            case OFFLINE -> createOfflineClient();
            case DISABLED -> createDisabledClient();
            case ONLINE -> createSqsClient(config);
        };
    }

    private QueueClient createOfflineClient() {
        LOG.info("Running in OFFLINE mode - queue operations are simulated");
        return new OfflineQueueClient(objectMapper, clock);
    }

    private QueueClient createDisabledClient() {
        LOG.warn("Message queue credentials not set - queue client disabled");
        return new DisabledQueueClient();
    }

    private QueueClient createSqsClient(QueueClientConfig config) {
        try {
            SqsClient sqsClient = SqsClient.builder()
                .endpointOverride(URI.create(config.endpoint()))
                .region(Region.of(config.region()))
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(
                    config.accessKeyId().orElseThrow(),
                    config.secretAccessKey().orElseThrow())))
                .httpClientBuilder(UrlConnectionHttpClient.builder())
                .build();

            LOG.infof("Creating SQS queue client: endpoint=%s, region=%s, prefix=%s",
                config.endpoint(), config.region(), config.queuePrefix());
            return new SqsQueueClient(sqsClient, config, objectMapper, clock);

        } catch (Exception e) {
            LOG.errorf(e, "Failed to create SQS client - queue client disabled");
            return new DisabledQueueClient();
        }
    }
}
