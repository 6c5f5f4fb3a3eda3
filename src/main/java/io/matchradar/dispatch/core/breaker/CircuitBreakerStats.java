package io.matchradar.dispatch.core.breaker;

import java.time.Instant;

public record CircuitBreakerStats(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailureTime,
        Instant nextAttemptTime
) {}
