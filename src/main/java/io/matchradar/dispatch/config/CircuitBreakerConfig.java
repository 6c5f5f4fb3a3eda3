package io.matchradar.dispatch.config;

import java.time.Duration;

/**
 * Breaker settings shared by every operation class.
 *
 * @param failureThreshold consecutive failures that open the breaker
 * @param resetTimeout     time an open breaker waits before letting a trial call through
 * @param monitoringPeriod observation window of the breaker settings; it does not expire the
 *                         consecutive failure count, however far apart failures arrive
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration resetTimeout,
        Duration monitoringPeriod
) {
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) failureThreshold = 5;
        if (resetTimeout == null) resetTimeout = Duration.ofMinutes(1);
        if (monitoringPeriod == null) monitoringPeriod = Duration.ofSeconds(10);
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(0, null, null);
    }
}
