package io.matchradar.dispatch.core.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
