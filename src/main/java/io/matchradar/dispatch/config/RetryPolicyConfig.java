package io.matchradar.dispatch.config;

import java.time.Duration;

public record RetryPolicyConfig(
        int maxAttempts,
        Duration baseDelay,
        double backoffFactor
) {
    public RetryPolicyConfig {
        if (maxAttempts <= 0) maxAttempts = 1;
        if (baseDelay == null) baseDelay = Duration.ZERO;
        if (backoffFactor < 1.0) backoffFactor = 1.0;
    }
}
