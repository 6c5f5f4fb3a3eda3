package io.matchradar.dispatch.core.queue;

public record LaneSettings(
        String category,
        int defaultPriority,
        int maxAttempts
) {
    public LaneSettings {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Lane category must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
    }
}
