package tech.tasktracker.backend.dispatch.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.tasktracker.backend.dispatch.InvalidPayloadException;
import tech.tasktracker.backend.dispatch.TaskEnvelope;
import tech.tasktracker.backend.metrics.MetricNames;
import tech.tasktracker.backend.metrics.MetricsStore;
import tech.tasktracker.backend.task.InMemoryTaskRepository;
import tech.tasktracker.backend.task.Task;
import tech.tasktracker.backend.task.TaskNotFoundException;
import tech.tasktracker.backend.task.TaskService;
import tech.tasktracker.backend.task.TaskStatus;
import tech.tasktracker.queue.MessageBody;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlersTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MetricsStore metrics;
    private TaskService taskService;
    private CreateTaskHandler createHandler;
    private UpdateTaskHandler updateHandler;
    private DeleteTaskHandler deleteHandler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        metrics = new MetricsStore(clock);
        taskService = new TaskService(new InMemoryTaskRepository(clock), metrics);
        createHandler = new CreateTaskHandler(taskService);
        updateHandler = new UpdateTaskHandler(taskService);
        deleteHandler = new DeleteTaskHandler(taskService);
    }

    @Test
    void createStoresTaskAndCountsDbOperation() {
        createHandler.handle(envelope("{\"type\":\"create_task\",\"data\":{\"title\":\"Ship it\",\"description\":\"today\"}}"));

        Task task = taskService.list().get(0);
        assertEquals("Ship it", task.title());
        assertEquals("today", task.description());
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(2L, metrics.counter(MetricNames.DB_OPERATIONS));
    }

    @Test
    void createWithoutTitleIsInvalid() {
        assertThrows(InvalidPayloadException.class,
            () -> createHandler.handle(envelope("{\"type\":\"create_task\",\"data\":{\"description\":\"x\"}}")));
        assertThrows(InvalidPayloadException.class,
            () -> createHandler.handle(envelope("{\"type\":\"create_task\"}")));
        assertThrows(InvalidPayloadException.class,
            () -> createHandler.handle(envelope("{\"type\":\"create_task\",\"data\":{\"title\":{\"a\":1}}}")));
    }

    @Test
    void updateAppliesPresentFields() {
        Task task = taskService.create("Draft", "v1");

        updateHandler.handle(envelope(
            "{\"type\":\"update_task\",\"data\":{\"id\":" + task.id() + ",\"status\":\"in_progress\"}}"));

        Task updated = taskService.get(task.id()).orElseThrow();
        assertEquals("Draft", updated.title());
        assertEquals(TaskStatus.IN_PROGRESS, updated.status());
    }

    @Test
    void updateRejectsBadIdAndStatus() {
        Task task = taskService.create("Draft", null);

        assertThrows(InvalidPayloadException.class,
            () -> updateHandler.handle(envelope("{\"type\":\"update_task\",\"data\":{\"id\":\"abc\"}}")));
        assertThrows(InvalidPayloadException.class, () -> updateHandler.handle(envelope(
            "{\"type\":\"update_task\",\"data\":{\"id\":" + task.id() + ",\"status\":\"archived\"}}")));
    }

    @Test
    void updateOfUnknownTaskFails() {
        assertThrows(TaskNotFoundException.class,
            () -> updateHandler.handle(envelope("{\"type\":\"update_task\",\"data\":{\"id\":999,\"title\":\"x\"}}")));
    }

    @Test
    void deleteRemovesTaskAndFailsOnSecondAttempt() {
        Task task = taskService.create("Temporary", null);
        TaskEnvelope delete = envelope("{\"type\":\"delete_task\",\"data\":{\"id\":" + task.id() + "}}");

        deleteHandler.handle(delete);

        assertTrue(taskService.get(task.id()).isEmpty());
        assertThrows(TaskNotFoundException.class, () -> deleteHandler.handle(delete));
    }

    private TaskEnvelope envelope(String json) {
        return TaskEnvelope.from(MessageBody.decode(json, mapper));
    }
}
