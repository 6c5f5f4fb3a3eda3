package io.matchradar.dispatch.core.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.matchradar.dispatch.core.dto.Task;

import java.time.Instant;

public record TaskCompletedEvent(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("category") String category,
        @JsonProperty("target") String target,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("completedAt") Instant completedAt
) {
    public static TaskCompletedEvent create(Task task) {
        return new TaskCompletedEvent(
                task.id(), task.category(), task.target(),
                task.attemptCount(), task.createdAt(), task.updatedAt()
        );
    }
}
