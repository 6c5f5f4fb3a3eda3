package io.matchradar.dispatch.core.dto;

import io.matchradar.dispatch.core.exception.ErrorKind;

import java.util.Map;

public record ErrorMetricsSnapshot(
        Map<ErrorKind, Long> errorsByKind,
        long totalErrors,
        long retryAttempts,
        long retrySuccesses,
        long retryFailures,
        double averageRetryDelayMs
) {
    public long errorsOf(ErrorKind kind) {
        return errorsByKind.getOrDefault(kind, 0L);
    }
}
