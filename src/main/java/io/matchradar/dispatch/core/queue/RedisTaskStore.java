package io.matchradar.dispatch.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.matchradar.dispatch.core.dto.Task;
import io.matchradar.dispatch.core.dto.TaskStatus;
import io.matchradar.dispatch.core.exception.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Stores each task as JSON under {@code dispatch:task:{id}} and indexes ids in one set per
 * lane and status, {@code dispatch:lane:{category}:{status}}.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch.queue", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisTaskStore implements TaskStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisTaskStore.class);

    static final String TASK_PREFIX = "dispatch:task:";
    static final String LANE_PREFIX = "dispatch:lane:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisTaskStore(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(Task task) {
        String key = taskKey(task.id());
        String previous = redisTemplate.opsForValue().get(key);

        if (previous != null) {
            Task old = fromJson(previous);
            if (old.status() != task.status()) {
                redisTemplate.opsForSet().remove(laneKey(old.category(), old.status()), task.id());
            }
        }

        redisTemplate.opsForValue().set(key, toJson(task));
        redisTemplate.opsForSet().add(laneKey(task.category(), task.status()), task.id());
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String json = redisTemplate.opsForValue().get(taskKey(taskId));
        return Optional.ofNullable(json).map(this::fromJson);
    }

    @Override
    public List<Task> findByCategoryAndStatus(String category, TaskStatus status) {
        Set<String> ids = redisTemplate.opsForSet().members(laneKey(category, status));
        return loadAll(ids);
    }

    @Override
    public long countByCategoryAndStatus(String category, TaskStatus status) {
        Long size = redisTemplate.opsForSet().size(laneKey(category, status));
        return size != null ? size : 0L;
    }

    @Override
    public List<Task> findByCategory(String category) {
        List<Task> tasks = new ArrayList<>();
        for (TaskStatus status : TaskStatus.values()) {
            tasks.addAll(findByCategoryAndStatus(category, status));
        }
        return tasks;
    }

    @Override
    public void delete(String taskId) {
        findById(taskId).ifPresent(task -> {
            redisTemplate.opsForSet().remove(laneKey(task.category(), task.status()), taskId);
            redisTemplate.delete(taskKey(taskId));
        });
    }

    private List<Task> loadAll(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        List<String> keys = ids.stream().map(RedisTaskStore::taskKey).toList();
        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return List.of();
        }

        if (values.contains(null)) {
            logger.warn("Lane index references {} missing tasks", values.stream().filter(Objects::isNull).count());
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(this::fromJson)
                .toList();
    }

    static String taskKey(String taskId) {
        return TASK_PREFIX + taskId;
    }

    static String laneKey(String category, TaskStatus status) {
        return LANE_PREFIX + category + ":" + status.name().toLowerCase(Locale.ROOT);
    }

    private String toJson(Task task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to serialize task " + task.id(), e);
        }
    }

    private Task fromJson(String json) {
        try {
            return objectMapper.readValue(json, Task.class);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Failed to deserialize task", e);
        }
    }
}
