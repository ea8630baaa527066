package io.aegis.core.safety;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Samples heap usage of this JVM and, where the platform bean exposes it, process CPU load.
 */
public final class JvmResourceProbe implements ResourceProbe {
    private static final long MB = 1024L * 1024L;

    private final Runtime runtime = Runtime.getRuntime();
    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public Sample sample() {
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / MB;
        return new Sample(usedMb, cpuPercent());
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            double load = mx.getProcessCpuLoad();
            return load < 0 ? 0.0 : load * 100.0;
        }
        return 0.0;
    }
}
