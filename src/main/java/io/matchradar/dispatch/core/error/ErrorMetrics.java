package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.dto.ErrorMetricsSnapshot;
import io.matchradar.dispatch.core.exception.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide failure counters. Every update and read takes the same lock.
 */
class ErrorMetrics {

    private static final long HOUR_MS = Duration.ofHours(1).toMillis();

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<ErrorKind, Long> errorsByKind = new EnumMap<>(ErrorKind.class);
    private final Map<ErrorKind, HourBucket> hourlyErrors = new EnumMap<>(ErrorKind.class);
    private long totalErrors;
    private long retryAttempts;
    private long retrySuccesses;
    private long retryFailures;
    private double averageRetryDelayMs;

    /**
     * Counts one error and returns how many errors of the kind were seen in the current hour.
     */
    long recordError(ErrorKind kind, Instant now) {
        lock.lock();
        try {
            errorsByKind.merge(kind, 1L, Long::sum);
            totalErrors++;

            long hourStart = now.toEpochMilli() - (now.toEpochMilli() % HOUR_MS);
            HourBucket bucket = hourlyErrors.get(kind);
            if (bucket == null || bucket.hourStart != hourStart) {
                bucket = new HourBucket(hourStart);
                hourlyErrors.put(kind, bucket);
            }
            return ++bucket.count;
        } finally {
            lock.unlock();
        }
    }

    void recordRetryAttempt(long delayMs) {
        lock.lock();
        try {
            retryAttempts++;
            averageRetryDelayMs += (delayMs - averageRetryDelayMs) / retryAttempts;
        } finally {
            lock.unlock();
        }
    }

    void recordRetrySuccess() {
        lock.lock();
        try {
            retrySuccesses++;
        } finally {
            lock.unlock();
        }
    }

    void recordRetryFailure() {
        lock.lock();
        try {
            retryFailures++;
        } finally {
            lock.unlock();
        }
    }

    ErrorMetricsSnapshot snapshot() {
        lock.lock();
        try {
            return new ErrorMetricsSnapshot(
                    Map.copyOf(errorsByKind),
                    totalErrors,
                    retryAttempts,
                    retrySuccesses,
                    retryFailures,
                    averageRetryDelayMs
            );
        } finally {
            lock.unlock();
        }
    }

    void reset() {
        lock.lock();
        try {
            errorsByKind.clear();
            hourlyErrors.clear();
            totalErrors = 0;
            retryAttempts = 0;
            retrySuccesses = 0;
            retryFailures = 0;
            averageRetryDelayMs = 0.0;
        } finally {
            lock.unlock();
        }
    }

    private static final class HourBucket {
        private final long hourStart;
        private long count;

        private HourBucket(long hourStart) {
            this.hourStart = hourStart;
        }
    }
}
