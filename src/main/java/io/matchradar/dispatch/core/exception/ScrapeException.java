package io.matchradar.dispatch.core.exception;

import java.time.Duration;

/**
 * A failure of the scraping collaborator tagged with its {@link ErrorKind}.
 */
public class ScrapeException extends DispatchException implements ClassifiedError {

    private final ErrorKind kind;
    private final Boolean retryable;
    private final Duration retryAfter;

    public ScrapeException(String message, ErrorKind kind) {
        this(message, null, kind, null, null);
    }

    public ScrapeException(String message, Throwable cause, ErrorKind kind) {
        this(message, cause, kind, null, null);
    }

    public ScrapeException(String message, Throwable cause, ErrorKind kind, Boolean retryable, Duration retryAfter) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public static ScrapeException nonRetryable(String message, ErrorKind kind) {
        return new ScrapeException(message, null, kind, Boolean.FALSE, null);
    }

    public static ScrapeException rateLimited(String message, Duration retryAfter) {
        return new ScrapeException(message, null, ErrorKind.NETWORK, Boolean.TRUE, retryAfter);
    }

    @Override
    public ErrorKind errorKind() {
        return kind;
    }

    @Override
    public Boolean retryableHint() {
        return retryable;
    }

    /**
     * Minimum wait the source asked for before the next attempt, or {@code null}.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
