package io.matchradar.dispatch.core.scheduler;

import io.matchradar.dispatch.core.dto.TaskCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in recurring intervals and payloads of the known categories.
 */
public final class DefaultSchedules {

    private DefaultSchedules() {
    }

    public static Duration intervalFor(TaskCategory category) {
        return switch (category) {
            case LIVE_MATCH -> Duration.ofMinutes(1);
            case UPCOMING_FIXTURE -> Duration.ofHours(3);
            case HISTORICAL_DATA -> Duration.ofDays(1);
            case LEAGUE_DISCOVERY -> Duration.ofDays(7);
        };
    }

    public static PayloadBuilder payloadBuilder() {
        return DefaultSchedules::payload;
    }

    private static Map<String, Object> payload(String category, Instant scheduledAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskType", category);
        payload.put("scheduledAt", scheduledAt.toString());

        TaskCategory.fromCode(category).ifPresent(known -> {
            payload.put("priority", known.defaultPriority());
            switch (known) {
                case LIVE_MATCH -> {
                    payload.put("dataType", "live");
                    payload.put("maxPages", 5);
                }
                case UPCOMING_FIXTURE -> {
                    payload.put("dataType", "upcoming");
                    payload.put("daysAhead", 7);
                    payload.put("maxPages", 10);
                }
                case HISTORICAL_DATA -> {
                    payload.put("dataType", "historical");
                    payload.put("daysBack", 1);
                    payload.put("maxPages", 20);
                }
                case LEAGUE_DISCOVERY -> {
                    payload.put("dataType", "discovery");
                    payload.put("maxDepth", 3);
                }
            }
        });
        return payload;
    }
}
