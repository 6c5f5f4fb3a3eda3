package io.matchradar.dispatch.core.exception;

import java.time.Instant;

/**
 * Raised by a breaker that rejected a call without invoking the operation. Signals
 * "not attempted", so it is never classified into an {@link ErrorKind}.
 */
public class CircuitOpenException extends DispatchException {

    private final String breakerName;
    private final Instant nextAttemptTime;

    public CircuitOpenException(String breakerName, Instant nextAttemptTime) {
        super("Circuit breaker '" + breakerName + "' is OPEN, next attempt at " + nextAttemptTime);
        this.breakerName = breakerName;
        this.nextAttemptTime = nextAttemptTime;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Instant getNextAttemptTime() {
        return nextAttemptTime;
    }
}
