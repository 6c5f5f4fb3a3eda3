package io.matchradar.dispatch.core.scheduler;

import io.matchradar.dispatch.core.dto.ScheduleStats;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping of one recurring schedule.
 */
class ScheduleState {

    final String id;
    final String category;
    final PayloadBuilder payloadBuilder;
    final AtomicBoolean running = new AtomicBoolean();

    private Duration interval;
    private ScheduledFuture<?> future;
    private boolean paused;
    private long totalRuns;
    private long successfulRuns;
    private long failedRuns;
    private long skippedRuns;
    private Instant lastRun;
    private Instant lastSuccess;
    private double averageExecutionMs;

    ScheduleState(String id, String category, Duration interval, PayloadBuilder payloadBuilder) {
        this.id = id;
        this.category = category;
        this.interval = interval;
        this.payloadBuilder = payloadBuilder;
    }

    synchronized Duration interval() {
        return interval;
    }

    synchronized void setInterval(Duration interval) {
        this.interval = interval;
    }

    synchronized boolean isPaused() {
        return paused;
    }

    synchronized void setPaused(boolean paused) {
        this.paused = paused;
    }

    synchronized void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    synchronized void detach() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    synchronized void recordStart(Instant now) {
        totalRuns++;
        lastRun = now;
    }

    synchronized void recordSuccess(Instant now, long executionMs) {
        successfulRuns++;
        lastSuccess = now;
        averageExecutionMs = (averageExecutionMs * (totalRuns - 1) + executionMs) / totalRuns;
    }

    synchronized void recordFailure(long executionMs) {
        failedRuns++;
        averageExecutionMs = (averageExecutionMs * (totalRuns - 1) + executionMs) / totalRuns;
    }

    synchronized void recordSkip() {
        skippedRuns++;
    }

    synchronized ScheduleStats toStats() {
        return new ScheduleStats(category, interval, future != null, paused, running.get(), totalRuns, successfulRuns,
                failedRuns, skippedRuns, lastRun, lastSuccess, averageExecutionMs);
    }
}
