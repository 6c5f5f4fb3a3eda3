package io.matchradar.dispatch.core.dto;

import java.time.Duration;
import java.time.Instant;

public record ScheduleStats(
        String category,
        Duration interval,
        boolean scheduled,
        boolean paused,
        boolean running,
        long totalRuns,
        long successfulRuns,
        long failedRuns,
        long skippedRuns,
        Instant lastRun,
        Instant lastSuccess,
        double averageExecutionMs
) {
    public double getSuccessRate() {
        return totalRuns > 0 ? (double) successfulRuns / totalRuns : 0.0;
    }
}
