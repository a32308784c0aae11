package tech.tasktracker.backend.endpoint;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import tech.tasktracker.backend.metrics.ApplicationMetrics;
import tech.tasktracker.backend.metrics.MetricNames;
import tech.tasktracker.backend.metrics.MetricsStore;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class MonitoringResourceTest {

    @Inject
    MetricsStore metricsStore;

    @Test
    void shouldReturnFullSnapshot() {
        given()
            .when().get("/metrics")
            .then()
            .statusCode(200)
            .contentType("application/json")
            .body("status", equalTo("healthy"))
            .body("application.counters", hasKey(MetricNames.REQUESTS_TOTAL))
            .body("application.counters", hasKey(MetricNames.QUEUE_MESSAGES_PROCESSED))
            .body("system.threadCount", greaterThan(0))
            .body("timestamp", notNullValue());
    }

    @Test
    void shouldReturnApplicationAndSystemSections() {
        given()
            .when().get("/metrics/application")
            .then()
            .statusCode(200)
            .body("counters", hasKey(MetricNames.DB_OPERATIONS))
            .body("successRate", notNullValue());

        given()
            .when().get("/metrics/system")
            .then()
            .statusCode(200)
            .body("memoryMb", notNullValue())
            .body("uptimeSeconds", notNullValue());
    }

    @Test
    void shouldRenderPrometheusText() {
        given()
            .when().get("/metrics/prometheus")
            .then()
            .statusCode(200)
            .contentType(containsString("text/plain"))
            .body(containsString("# TYPE requests_total gauge"))
            .body(containsString("requests_total{type=\"application\"}"))
            .body(containsString("thread_count{type=\"system\"}"));
    }

    @Test
    void shouldAddTimingHeadersAndClassifyRequests() {
        long successBefore = metricsStore.counter(MetricNames.REQUESTS_SUCCESS);
        long errorBefore = metricsStore.counter(MetricNames.REQUESTS_ERROR);

        given()
            .when().get("/metrics/application")
            .then()
            .statusCode(200)
            .header("X-Response-Time", notNullValue())
            .header("X-Request-Id", matchesPattern("\\d+"));

        given()
            .when().get("/tasks/987654321")
            .then()
            .statusCode(404)
            .header("X-Response-Time", notNullValue());

        assertTrue(metricsStore.counter(MetricNames.REQUESTS_SUCCESS) >= successBefore + 1);
        assertTrue(metricsStore.counter(MetricNames.REQUESTS_ERROR) >= errorBefore + 1);
    }

    @Test
    void shouldCountRequestsToUnknownRoutes() {
        long totalBefore = metricsStore.counter(MetricNames.REQUESTS_TOTAL);
        long errorBefore = metricsStore.counter(MetricNames.REQUESTS_ERROR);

        given()
            .when().get("/no-such-route")
            .then()
            .statusCode(404)
            .header("X-Response-Time", notNullValue());

        assertTrue(metricsStore.counter(MetricNames.REQUESTS_TOTAL) >= totalBefore + 1);
        assertTrue(metricsStore.counter(MetricNames.REQUESTS_ERROR) >= errorBefore + 1);
    }

    @Test
    void shouldKeepRequestCountersConsistent() {
        given().when().get("/metrics/system").then().statusCode(200);
        given().when().get("/tasks/123456789").then().statusCode(404);

        ApplicationMetrics snapshot = metricsStore.snapshotApplication();
        assertEquals(snapshot.counter(MetricNames.REQUESTS_TOTAL),
            snapshot.counter(MetricNames.REQUESTS_SUCCESS) + snapshot.counter(MetricNames.REQUESTS_ERROR));
        assertEquals(snapshot.counter(MetricNames.REQUESTS_TOTAL), snapshot.responseTimeCount());
    }

    @Test
    void shouldResetCounters() {
        metricsStore.increment(MetricNames.DB_OPERATIONS, 5);
        metricsStore.increment("reset_probe", 3);

        given()
            .when().post("/metrics/reset")
            .then()
            .statusCode(200)
            .body("message", equalTo("Metrics reset"));

        ApplicationMetrics after = metricsStore.snapshotApplication();
        assertEquals(0L, after.counter("reset_probe"));
        assertEquals(0L, after.counter(MetricNames.QUEUE_MESSAGES_SENT));
        // The reset request itself is counted once its response is written
        assertTrue(after.counter(MetricNames.REQUESTS_TOTAL) <= 1);
    }
}
