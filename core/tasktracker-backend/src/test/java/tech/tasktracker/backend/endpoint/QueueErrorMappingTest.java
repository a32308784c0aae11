package tech.tasktracker.backend.endpoint;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.tasktracker.queue.QueueClient;
import tech.tasktracker.queue.QueueTransportException;
import tech.tasktracker.queue.QueueUnavailableException;

import java.util.List;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Queue client failures surface as 503 / 502.
 */
@QuarkusTest
class QueueErrorMappingTest {

    private static final String SEND_BODY = "{\"body\":{\"type\":\"create_task\",\"data\":{\"title\":\"x\"}}}";

    @InjectMock
    QueueClient queueClient;

    @BeforeEach
    void setUp() {
        reset(queueClient);
        when(queueClient.receive(anyString(), anyInt(), anyInt())).thenReturn(List.of());
    }

    @Test
    void shouldReturn503WhenQueueDisabled() {
        when(queueClient.send(anyString(), any(), anyInt(), anyMap()))
            .thenThrow(new QueueUnavailableException("Queue client is not configured"));

        given()
            .contentType("application/json")
            .body(SEND_BODY)
            .when().post("/queue/send")
            .then()
            .statusCode(503)
            .body("error", equalTo("Queue client is not configured"));
    }

    @Test
    void shouldReturn502OnTransportFailure() {
        when(queueClient.send(anyString(), any(), anyInt(), anyMap()))
            .thenThrow(new QueueTransportException("task-tracker-queue", "Connection refused", new RuntimeException()));

        given()
            .contentType("application/json")
            .body(SEND_BODY)
            .when().post("/queue/send")
            .then()
            .statusCode(502)
            .body("error", containsString("Connection refused"));
    }
}
