package io.matchradar.dispatch.config;

import java.time.Duration;

/**
 * Settings of one task lane. Zero or missing values fall back to the category defaults.
 */
public record LaneConfig(
        int defaultPriority,
        int maxAttempts,
        int concurrency,
        Duration timeout,
        Boolean enabled
) {
    public LaneConfig {
        if (maxAttempts <= 0) maxAttempts = 3;
        if (concurrency <= 0) concurrency = 1;
        if (timeout == null) timeout = Duration.ofSeconds(30);
        if (enabled == null) enabled = Boolean.TRUE;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
