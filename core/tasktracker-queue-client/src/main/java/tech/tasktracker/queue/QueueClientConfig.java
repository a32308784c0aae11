package tech.tasktracker.queue;

import java.util.Optional;

/**
 * Configuration for a queue client.
 *
 * @param accessKeyId     Static access key, absent when unconfigured
 * @param secretAccessKey Static secret key, absent when unconfigured
 * @param queuePrefix     URL prefix; queue URLs are {@code {queuePrefix}/{queueName}}
 * @param region          Signing region
 * @param endpoint        API endpoint of the SQS-compatible backend
 * @param offline         Force the offline mode regardless of credentials
 */
public record QueueClientConfig(
    Optional<String> accessKeyId,
    Optional<String> secretAccessKey,
    String queuePrefix,
    String region,
    String endpoint,
    boolean offline
) {
    public static final String DEFAULT_ENDPOINT = "https://message-queue.api.cloud.yandex.net";
    public static final String DEFAULT_REGION = "ru-central1";

    static final String OFFLINE_ACCESS_KEY = "test_access_key";
    static final String OFFLINE_SECRET_KEY = "test_secret_key";

    /**
     * Create config for the offline mode.
     */
    public static QueueClientConfig offline(String queuePrefix) {
        return new QueueClientConfig(Optional.empty(), Optional.empty(), queuePrefix,
            DEFAULT_REGION, DEFAULT_ENDPOINT, true);
    }

    /**
     * Create config for the remote backend with static credentials.
     */
    public static QueueClientConfig online(String accessKeyId, String secretAccessKey, String queuePrefix) {
        return new QueueClientConfig(Optional.ofNullable(accessKeyId), Optional.ofNullable(secretAccessKey),
            queuePrefix, DEFAULT_REGION, DEFAULT_ENDPOINT, false);
    }

    /**
     * Resolve the mode this configuration selects.
     * The well-known test credential pair also selects the offline mode.
     */
    public QueueMode mode() {
        if (offline) {
            return QueueMode.OFFLINE;
        }
        String key = accessKeyId.filter(s -> !s.isBlank()).orElse(null);
        String secret = secretAccessKey.filter(s -> !s.isBlank()).orElse(null);
        if (OFFLINE_ACCESS_KEY.equals(key) && OFFLINE_SECRET_KEY.equals(secret)) {
            return QueueMode.OFFLINE;
        }
        if (key == null || secret == null) {
            return QueueMode.DISABLED;
        }
        return QueueMode.ONLINE;
    }

    public String queueUrl(String queueName) {
        return queuePrefix + "/" + queueName;
    }
}
