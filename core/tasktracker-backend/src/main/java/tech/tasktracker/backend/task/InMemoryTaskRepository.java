package tech.tasktracker.backend.task;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task storage kept in process memory. Contents are lost on restart.
 */
@Singleton
public class InMemoryTaskRepository implements TaskRepository {

    private final ConcurrentHashMap<Long, Task> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    @Inject
    public InMemoryTaskRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<Task> findAll() {
        List<Task> all = new ArrayList<>(tasks.values());
        all.sort(Comparator.comparingLong(Task::id));
        return all;
    }

    @Override
    public Optional<Task> findById(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public Task create(String title, String description) {
        Instant now = clock.instant();
        Task task = new Task(sequence.incrementAndGet(), title, description, TaskStatus.PENDING, now, now);
        tasks.put(task.id(), task);
        return task;
    }

    @Override
    public Optional<Task> update(long id, String title, String description, TaskStatus status) {
        Instant now = clock.instant();
        return Optional.ofNullable(tasks.computeIfPresent(id,
            (key, existing) -> existing.withChanges(title, description, status, now)));
    }

    @Override
    public Optional<Task> delete(long id) {
        return Optional.ofNullable(tasks.remove(id));
    }
}
