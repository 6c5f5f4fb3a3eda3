package io.matchradar.dispatch.core.worker;

import io.matchradar.dispatch.core.dto.Task;

/**
 * Performs the scraping work of one task. Implementations signal failures by throwing,
 * preferably a {@link io.matchradar.dispatch.core.exception.ScrapeException} tagged with its kind.
 */
@FunctionalInterface
public interface ScrapeExecutor {

    Object execute(Task task) throws Exception;
}
