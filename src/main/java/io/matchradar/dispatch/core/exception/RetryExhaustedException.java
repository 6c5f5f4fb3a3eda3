package io.matchradar.dispatch.core.exception;

/**
 * The last error of an operation whose retry attempts have all failed.
 */
public class RetryExhaustedException extends DispatchException implements ClassifiedError {

    private final ErrorKind kind;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, ErrorKind kind, Throwable lastError) {
        super(String.format("%s failed after %d attempts: %s", operationName, attempts, lastError.getMessage()), lastError);
        this.kind = kind;
        this.attempts = attempts;
    }

    @Override
    public ErrorKind errorKind() {
        return kind;
    }

    @Override
    public Boolean retryableHint() {
        return Boolean.FALSE;
    }

    public int getAttempts() {
        return attempts;
    }
}
