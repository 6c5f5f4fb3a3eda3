package io.matchradar.dispatch.core.dto;

import java.util.Map;

/**
 * Where a failure happened.
 */
public record ErrorContext(
        String component,
        String operation,
        Map<String, Object> metadata
) {
    public ErrorContext {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ErrorContext of(String component, String operation) {
        return new ErrorContext(component, operation, Map.of());
    }
}
