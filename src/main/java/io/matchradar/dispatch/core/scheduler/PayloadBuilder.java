package io.matchradar.dispatch.core.scheduler;

import java.time.Instant;
import java.util.Map;

/**
 * Builds the payload of the task enqueued by one scheduler tick.
 */
@FunctionalInterface
public interface PayloadBuilder {

    Map<String, Object> build(String category, Instant scheduledAt);
}
