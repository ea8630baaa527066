package io.aegis.core.safety;

/**
 * Source of the memory and CPU figures compared against {@link ResourceLimits}.
 */
@FunctionalInterface
public interface ResourceProbe {

    Sample sample();

    /**
     * Reports zero usage, which leaves only the concurrency ceiling in force.
     */
    static ResourceProbe none() {
        return () -> new Sample(0, 0.0);
    }

    record Sample(long memoryUsageMb, double cpuUsagePercent) {
    }
}
