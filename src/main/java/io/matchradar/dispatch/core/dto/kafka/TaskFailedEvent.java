package io.matchradar.dispatch.core.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.matchradar.dispatch.core.dto.Task;

import java.time.Instant;

public record TaskFailedEvent(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("category") String category,
        @JsonProperty("target") String target,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("failedAt") Instant failedAt
) {
    public static TaskFailedEvent create(Task task) {
        return new TaskFailedEvent(
                task.id(), task.category(), task.target(), task.attemptCount(),
                task.maxAttempts(), task.failureReason(), task.updatedAt()
        );
    }
}
