package io.matchradar.dispatch.config;

import java.util.Map;

/**
 * Hourly error counts per kind (keyed by lower-case kind name) that trigger an alert.
 */
public record ErrorAlertConfig(
        Map<String, Integer> alertThresholds
) {
    private static final int FALLBACK_THRESHOLD = 15;

    public ErrorAlertConfig {
        if (alertThresholds == null) alertThresholds = Map.of();
    }

    public static ErrorAlertConfig defaults() {
        return new ErrorAlertConfig(null);
    }

    public int thresholdFor(String kindKey) {
        return alertThresholds.getOrDefault(kindKey, FALLBACK_THRESHOLD);
    }
}
