package io.matchradar.dispatch.core.exception;

public class TaskStoreException extends DispatchException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
