package io.matchradar.dispatch.core.dto;

import io.matchradar.dispatch.core.exception.ErrorKind;

import java.time.Instant;

public record ErrorRecord(
        ErrorKind kind,
        String message,
        ErrorContext context,
        Instant timestamp,
        boolean retryable,
        String errorType,
        String stackTrace
) {}
