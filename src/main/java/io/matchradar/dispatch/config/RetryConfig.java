package io.matchradar.dispatch.config;

import java.time.Duration;
import java.util.Map;

public record RetryConfig(
        Duration maxDelay,
        Double jitterFactor,
        Map<String, RetryPolicyConfig> policies
) {
    public RetryConfig {
        if (maxDelay == null) maxDelay = Duration.ofSeconds(30);
        if (jitterFactor == null) jitterFactor = 0.1;
        if (jitterFactor < 0.0) jitterFactor = 0.0;
        if (policies == null) policies = Map.of();
    }

    public static RetryConfig defaults() {
        return new RetryConfig(null, null, null);
    }

    public RetryPolicyConfig policyFor(String kindKey) {
        return policies.get(kindKey);
    }
}
