package io.matchradar.dispatch.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record QueueConfig(
        String store,
        Duration retention,
        Duration cleanupInterval,
        Duration idlePollInterval,
        Map<String, LaneConfig> lanes
) {
    public QueueConfig {
        if (store == null || store.isBlank()) store = "redis";
        if (retention == null) retention = Duration.ofHours(24);
        if (cleanupInterval == null) cleanupInterval = Duration.ofHours(1);
        if (idlePollInterval == null) idlePollInterval = Duration.ofMillis(500);
        lanes = lanes == null ? Map.of() : new LinkedHashMap<>(lanes);
    }

    public static QueueConfig defaults() {
        return new QueueConfig(null, null, null, null, null);
    }
}
