package io.matchradar.dispatch.core.dto;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    RETRY_SCHEDULED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
