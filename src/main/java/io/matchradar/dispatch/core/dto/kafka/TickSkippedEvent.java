package io.matchradar.dispatch.core.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record TickSkippedEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("category") String category,
        @JsonProperty("reason") String reason,
        @JsonProperty("load") double load,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("skippedAt") Instant skippedAt
) {
    public static TickSkippedEvent create(String category, String reason, double load,
                                          double threshold, Instant skippedAt) {
        return new TickSkippedEvent(
                UUID.randomUUID().toString(), category, reason, load, threshold, skippedAt
        );
    }
}
