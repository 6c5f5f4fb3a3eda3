package io.matchradar.dispatch.core.scheduler;

/**
 * Source of the current system load, normalized to 0.0 (idle) .. 1.0 (saturated).
 */
@FunctionalInterface
public interface SystemLoadProbe {

    double currentLoad();
}
