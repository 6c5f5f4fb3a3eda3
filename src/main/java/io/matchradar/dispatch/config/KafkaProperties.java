package io.matchradar.dispatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String taskCompleted,
        String taskFailed,
        String tickSkipped
) {
    public KafkaProperties {
        if (taskCompleted == null) taskCompleted = "dispatch.task.completed";
        if (taskFailed == null) taskFailed = "dispatch.task.failed";
        if (tickSkipped == null) tickSkipped = "dispatch.tick.skipped";
    }
}
