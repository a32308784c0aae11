package tech.tasktracker.backend.task;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.metrics.MetricNames;
import tech.tasktracker.backend.metrics.MetricsStore;

import java.util.List;
import java.util.Optional;

/**
 * Task operations shared by the HTTP endpoints and the queue message handlers.
 * Every storage call counts as one {@code db_operations}.
 */
@ApplicationScoped
public class TaskService {

    private static final Logger LOG = Logger.getLogger(TaskService.class);

    @Inject
    TaskRepository repository;

    @Inject
    MetricsStore metrics;

    public TaskService() {
        // CDI will inject dependencies
    }

    public TaskService(TaskRepository repository, MetricsStore metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    public List<Task> list() {
        metrics.increment(MetricNames.DB_OPERATIONS);
        return repository.findAll();
    }

    public Optional<Task> get(long id) {
        metrics.increment(MetricNames.DB_OPERATIONS);
        return repository.findById(id);
    }

    public Task create(String title, String description) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        metrics.increment(MetricNames.DB_OPERATIONS);
        Task task = repository.create(title, description);
        LOG.debugf("Task [%d] created", task.id());
        return task;
    }

    public Optional<Task> update(long id, String title, String description, TaskStatus status) {
        metrics.increment(MetricNames.DB_OPERATIONS);
        return repository.update(id, title, description, status);
    }

    public Optional<Task> delete(long id) {
        metrics.increment(MetricNames.DB_OPERATIONS);
        return repository.delete(id);
    }
}
