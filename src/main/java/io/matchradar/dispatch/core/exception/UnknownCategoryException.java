package io.matchradar.dispatch.core.exception;

public class UnknownCategoryException extends DispatchException {

    public UnknownCategoryException(String category) {
        super("Unknown task category: " + category);
    }
}
