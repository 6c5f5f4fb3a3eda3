package io.matchradar.dispatch.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record SchedulerConfig(
        boolean enabled,
        double loadThreshold,
        Duration initialDelay,
        Map<String, Duration> intervals
) {
    public SchedulerConfig {
        if (loadThreshold <= 0.0) loadThreshold = 0.8;
        if (initialDelay == null) initialDelay = Duration.ofSeconds(30);
        intervals = intervals == null ? Map.of() : new LinkedHashMap<>(intervals);
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(false, 0.8, null, null);
    }
}
