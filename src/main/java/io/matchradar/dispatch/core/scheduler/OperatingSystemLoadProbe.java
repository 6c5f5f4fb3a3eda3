package io.matchradar.dispatch.core.scheduler;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * One-minute load average divided by the processor count. Reports 0.0 on platforms
 * without a load average.
 */
@Component
public class OperatingSystemLoadProbe implements SystemLoadProbe {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double currentLoad() {
        double average = os.getSystemLoadAverage();
        if (average < 0) {
            return 0.0;
        }
        double perProcessor = average / Math.max(1, os.getAvailableProcessors());
        return Math.min(1.0, Math.max(0.0, perProcessor));
    }
}
