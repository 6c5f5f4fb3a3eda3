package io.matchradar.dispatch.core.exception;

import io.matchradar.dispatch.core.dto.TaskStatus;

public class IllegalTaskStateException extends DispatchException {

    public IllegalTaskStateException(String taskId, TaskStatus actual, String operation) {
        super(String.format("Cannot %s task %s in status %s", operation, taskId, actual));
    }
}
