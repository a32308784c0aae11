package tech.tasktracker.queue;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueueClientConfigTest {

    private static final String PREFIX = "https://message-queue.api.cloud.yandex.net/b1g/dj6";

    @Test
    void offlineFlagWinsOverCredentials() {
        QueueClientConfig config = new QueueClientConfig(Optional.of("key"), Optional.of("secret"),
            PREFIX, "ru-central1", QueueClientConfig.DEFAULT_ENDPOINT, true);

        assertEquals(QueueMode.OFFLINE, config.mode());
    }

    @Test
    void testCredentialPairSelectsOfflineMode() {
        QueueClientConfig config = QueueClientConfig.online("test_access_key", "test_secret_key", PREFIX);

        assertEquals(QueueMode.OFFLINE, config.mode());
    }

    @Test
    void missingOrBlankCredentialsDisableTheClient() {
        assertEquals(QueueMode.DISABLED, QueueClientConfig.online(null, "secret", PREFIX).mode());
        assertEquals(QueueMode.DISABLED, QueueClientConfig.online("key", null, PREFIX).mode());
        assertEquals(QueueMode.DISABLED, QueueClientConfig.online("  ", "secret", PREFIX).mode());
    }

    @Test
    void realCredentialsSelectOnlineMode() {
        assertEquals(QueueMode.ONLINE, QueueClientConfig.online("AKIA123", "s3cr3t", PREFIX).mode());
    }

    @Test
    void queueUrlJoinsPrefixAndName() {
        assertEquals(PREFIX + "/task-tracker-queue", QueueClientConfig.offline(PREFIX).queueUrl("task-tracker-queue"));
    }
}
