package io.matchradar.dispatch.core;

/**
 * A unit of work guarded by the breaker and the retry manager, typically a call into the
 * scraping engine.
 */
@FunctionalInterface
public interface ScrapeOperation<T> {

    T execute() throws Exception;
}
