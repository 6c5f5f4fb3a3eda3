package io.matchradar.dispatch.core.queue;

import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of task records. Writes are upserts keyed by task id; implementations keep
 * the category/status index consistent with the last saved status.
 */
public interface TaskStore {

    void save(Task task);

    Optional<Task> findById(String taskId);

    List<Task> findByCategoryAndStatus(String category, TaskStatus status);

    long countByCategoryAndStatus(String category, TaskStatus status);

    List<Task> findByCategory(String category);

    void delete(String taskId);
}
