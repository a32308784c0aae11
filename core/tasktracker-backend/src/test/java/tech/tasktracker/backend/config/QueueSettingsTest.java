package tech.tasktracker.backend.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class QueueSettingsTest {

    @Inject
    QueueSettings queueSettings;

    @Test
    void shouldResolveQueueSettingsFromEnvironmentDefaults() {
        assertEquals("https://message-queue.api.cloud.yandex.net/b1g1qglub2qdq4p5ibol/g6000000a3u94706n1",
            queueSettings.prefix());
        assertEquals("task-tracker-queue", queueSettings.defaultQueue());
        assertEquals("ru-central1", queueSettings.region());
        assertTrue(queueSettings.offline());
        assertTrue(queueSettings.accessKeyId().isEmpty());
    }
}
