package io.matchradar.dispatch.core.error;

import io.matchradar.dispatch.core.exception.ErrorKind;

import java.time.Instant;

@FunctionalInterface
public interface AlertCallback {

    void onAlert(Alert alert);

    record Alert(ErrorKind kind, long count, int threshold, ErrorKind.Severity severity, Instant raisedAt) {}
}
