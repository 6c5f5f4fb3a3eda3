package io.matchradar.dispatch.core.queue;

import io.matchradar.dispatch.core.dto.Task;

/**
 * Notified after a task reaches a terminal state and the new state is stored.
 */
public interface TaskLifecycleListener {

    default void taskCompleted(Task task) {
    }

    default void taskFailed(Task task) {
    }
}
