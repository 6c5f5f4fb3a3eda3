package io.matchradar.dispatch.core.exception;

public class TaskNotFoundException extends DispatchException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
