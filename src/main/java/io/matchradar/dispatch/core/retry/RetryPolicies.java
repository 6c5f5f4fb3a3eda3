package io.matchradar.dispatch.core.retry;

import io.matchradar.dispatch.config.DispatchConfig;
import io.matchradar.dispatch.config.RetryConfig;
import io.matchradar.dispatch.config.RetryPolicyConfig;
import io.matchradar.dispatch.core.exception.ErrorKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default retry policy of each {@link ErrorKind}. Network failures are retried the most;
 * validation and configuration failures are not retried since the same input fails again.
 */
@Component
public class RetryPolicies {

    private final Map<ErrorKind, RetryPolicy> policies = new EnumMap<>(ErrorKind.class);

    @Autowired
    public RetryPolicies(DispatchConfig dispatchConfig) {
        this(dispatchConfig.retry());
    }

    RetryPolicies(RetryConfig retryConfig) {
        for (ErrorKind kind : ErrorKind.values()) {
            RetryPolicyConfig override = retryConfig.policyFor(kind.configKey());
            RetryPolicy base = override != null
                    ? RetryPolicy.of(override.maxAttempts(), override.baseDelay(), override.backoffFactor())
                    : builtIn(kind);
            policies.put(kind, base
                    .withJitterFactor(Math.min(retryConfig.jitterFactor(), 1.0))
                    .withMaxDelay(retryConfig.maxDelay()));
        }
    }

    public RetryPolicy policyFor(ErrorKind kind) {
        return policies.get(kind);
    }

    private static RetryPolicy builtIn(ErrorKind kind) {
        return switch (kind) {
            case NETWORK -> RetryPolicy.of(5, Duration.ofSeconds(1), 2.0);
            case SCRAPING -> RetryPolicy.of(3, Duration.ofSeconds(2), 2.0);
            case SYSTEM -> RetryPolicy.of(2, Duration.ofSeconds(1), 2.0);
            case VALIDATION, CONFIGURATION -> RetryPolicy.noRetry();
        };
    }
}
