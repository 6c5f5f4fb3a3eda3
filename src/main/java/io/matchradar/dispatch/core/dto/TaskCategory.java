package io.matchradar.dispatch.core.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in task categories. Each one gets its own lane unless the configuration
 * defines the lanes explicitly.
 */
public enum TaskCategory {
    LIVE_MATCH("live-match", 100, 3),
    UPCOMING_FIXTURE("upcoming-fixture", 75, 3),
    HISTORICAL_DATA("historical-data", 50, 3),
    LEAGUE_DISCOVERY("league-discovery", 25, 2);

    private final String code;
    private final int defaultPriority;
    private final int defaultMaxAttempts;

    TaskCategory(String code, int defaultPriority, int defaultMaxAttempts) {
        this.code = code;
        this.defaultPriority = defaultPriority;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public String code() {
        return code;
    }

    public int defaultPriority() {
        return defaultPriority;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public static Optional<TaskCategory> fromCode(String code) {
        return Arrays.stream(values())
                .filter(category -> category.code.equals(code))
                .findFirst();
    }
}
