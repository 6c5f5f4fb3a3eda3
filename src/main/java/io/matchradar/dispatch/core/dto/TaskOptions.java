package io.matchradar.dispatch.core.dto;

import java.time.Duration;

/**
 * Optional overrides for {@code addTask}. Any {@code null} component uses the lane default.
 */
public record TaskOptions(
        String target,
        Integer priority,
        Integer maxAttempts,
        Duration delay
) {
    public static TaskOptions defaults() {
        return new TaskOptions(null, null, null, null);
    }

    public static TaskOptions target(String target) {
        return new TaskOptions(target, null, null, null);
    }

    public TaskOptions withPriority(int priority) {
        return new TaskOptions(target, priority, maxAttempts, delay);
    }

    public TaskOptions withMaxAttempts(int maxAttempts) {
        return new TaskOptions(target, priority, maxAttempts, delay);
    }

    public TaskOptions withDelay(Duration delay) {
        return new TaskOptions(target, priority, maxAttempts, delay);
    }
}
