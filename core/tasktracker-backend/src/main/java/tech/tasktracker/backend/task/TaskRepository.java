package tech.tasktracker.backend.task;

import java.util.List;
import java.util.Optional;

/**
 * Storage for tasks.
 */
public interface TaskRepository {

    List<Task> findAll();

    Optional<Task> findById(long id);

    Task create(String title, String description);

    /**
     * Apply the non-null fields to an existing task.
     *
     * @return the updated task, or empty if no task has this ID
     */
    Optional<Task> update(long id, String title, String description, TaskStatus status);

    /**
     * @return the removed task, or empty if no task has this ID
     */
    Optional<Task> delete(long id);
}
