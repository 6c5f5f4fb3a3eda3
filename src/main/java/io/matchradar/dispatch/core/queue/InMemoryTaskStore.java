package io.matchradar.dispatch.core.queue;

import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.TaskStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "dispatch.queue", name = "store", havingValue = "memory")
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findByCategoryAndStatus(String category, TaskStatus status) {
        return tasks.values().stream()
                .filter(task -> task.category().equals(category) && task.status() == status)
                .toList();
    }

    @Override
    public long countByCategoryAndStatus(String category, TaskStatus status) {
        return tasks.values().stream()
                .filter(task -> task.category().equals(category) && task.status() == status)
                .count();
    }

    @Override
    public List<Task> findByCategory(String category) {
        return tasks.values().stream()
                .filter(task -> task.category().equals(category))
                .toList();
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }
}
