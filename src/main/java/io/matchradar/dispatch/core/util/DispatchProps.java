package io.matchradar.dispatch.core.util;

import io.matchradar.dispatch.config.DispatchConfig;
import org.springframework.stereotype.Component;

/**
 * Millisecond views of duration settings, for {@code @Scheduled} expressions.
 */
@Component
public class DispatchProps {
    private final long cleanupIntervalMs;

    public DispatchProps(DispatchConfig config) {
        this.cleanupIntervalMs = config.queue().cleanupInterval().toMillis();
    }

    // queue maintenance
    public long getCleanupIntervalMs() { return cleanupIntervalMs; }
}
