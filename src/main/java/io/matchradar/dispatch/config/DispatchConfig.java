package io.matchradar.dispatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch")
public record DispatchConfig(
        CircuitBreakerConfig circuitBreaker,
        RetryConfig retry,
        QueueConfig queue,
        SchedulerConfig scheduler,
        ErrorAlertConfig errors
) {
    public DispatchConfig {
        if (circuitBreaker == null) circuitBreaker = CircuitBreakerConfig.defaults();
        if (retry == null) retry = RetryConfig.defaults();
        if (queue == null) queue = QueueConfig.defaults();
        if (scheduler == null) scheduler = SchedulerConfig.defaults();
        if (errors == null) errors = ErrorAlertConfig.defaults();
    }

    public static DispatchConfig defaults() {
        return new DispatchConfig(null, null, null, null, null);
    }
}
