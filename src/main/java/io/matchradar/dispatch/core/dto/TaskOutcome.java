package io.matchradar.dispatch.core.dto;

import java.time.Duration;

/**
 * Result a worker reports for a claimed task.
 */
public record TaskOutcome(
        Type type,
        Throwable error,
        Duration delay
) {
    public enum Type { COMPLETED, FAILED, RETRY_REQUESTED, POSTPONED }

    public static TaskOutcome completed() {
        return new TaskOutcome(Type.COMPLETED, null, null);
    }

    public static TaskOutcome failed(Throwable error) {
        return new TaskOutcome(Type.FAILED, error, null);
    }

    public static TaskOutcome retryRequested() {
        return new TaskOutcome(Type.RETRY_REQUESTED, null, null);
    }

    public static TaskOutcome retryRequested(Throwable error, Duration delay) {
        return new TaskOutcome(Type.RETRY_REQUESTED, error, delay);
    }

    /**
     * The task was claimed but not attempted; it goes back to its lane without using up an attempt.
     */
    public static TaskOutcome postponed(Throwable error, Duration delay) {
        return new TaskOutcome(Type.POSTPONED, error, delay);
    }
}
