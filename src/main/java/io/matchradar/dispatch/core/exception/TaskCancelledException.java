package io.matchradar.dispatch.core.exception;

/**
 * Reported as a task's failure to cancel it. Terminal, never retried.
 */
public class TaskCancelledException extends DispatchException {

    public TaskCancelledException(String reason) {
        super("Task cancelled: " + reason);
    }
}
