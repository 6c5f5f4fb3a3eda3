package io.matchradar.dispatch.core.dto;

public record QueueStats(
        String category,
        int waiting,
        int inProgress,
        int completed,
        int failed,
        int delayed,
        boolean paused
) {
    public int total() {
        return waiting + inProgress + completed + failed + delayed;
    }
}
