package io.matchradar.dispatch.core.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of scraping work. Immutable; every state change produces a new copy that the
 * queue writes back to the store.
 *
 * @param attemptCount number of times the task has been claimed
 * @param sequence     submission order within the process, breaks priority ties
 * @param availableAt  earliest claim time of a {@link TaskStatus#RETRY_SCHEDULED} task
 */
public record Task(
        String id,
        String target,
        String category,
        int priority,
        TaskStatus status,
        int attemptCount,
        int maxAttempts,
        long sequence,
        Instant createdAt,
        Instant updatedAt,
        Instant availableAt,
        String failureReason,
        Map<String, Object> payload
) {
    public Task {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Task create(String id, String target, String category, int priority, int maxAttempts,
                              long sequence, Instant now, Map<String, Object> payload) {
        return new Task(id, target, category, priority, TaskStatus.PENDING, 0, maxAttempts,
                sequence, now, now, null, null, payload);
    }

    public Task claimed(Instant now) {
        return new Task(id, target, category, priority, TaskStatus.IN_PROGRESS, attemptCount + 1, maxAttempts,
                sequence, createdAt, now, null, failureReason, payload);
    }

    /**
     * Gives back the attempt counted by the last claim, for a claim that never ran.
     */
    public Task released() {
        return new Task(id, target, category, priority, status, Math.max(0, attemptCount - 1), maxAttempts,
                sequence, createdAt, updatedAt, availableAt, failureReason, payload);
    }

    public Task completed(Instant now) {
        return new Task(id, target, category, priority, TaskStatus.COMPLETED, attemptCount, maxAttempts,
                sequence, createdAt, now, null, null, payload);
    }

    public Task failed(Instant now, String reason) {
        return new Task(id, target, category, priority, TaskStatus.FAILED, attemptCount, maxAttempts,
                sequence, createdAt, now, null, reason, payload);
    }

    public Task requeued(Instant now, String reason) {
        return new Task(id, target, category, priority, TaskStatus.PENDING, attemptCount, maxAttempts,
                sequence, createdAt, now, null, reason, payload);
    }

    public Task delayedUntil(Instant now, Instant availableAt, String reason) {
        return new Task(id, target, category, priority, TaskStatus.RETRY_SCHEDULED, attemptCount, maxAttempts,
                sequence, createdAt, now, availableAt, reason, payload);
    }

    public Task resetForRetry(Instant now, long newSequence) {
        return new Task(id, target, category, priority, TaskStatus.PENDING, 0, maxAttempts,
                newSequence, createdAt, now, null, null, payload);
    }

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }

    public boolean isDue(Instant now) {
        return availableAt == null || !availableAt.isAfter(now);
    }
}
