package io.aegis.core.safety;

public record ResourceLimits(
    long maxMemoryMb,
    double maxCpuPercent,
    long maxExecutionTimeSecs,
    int maxConcurrentCommands
) {

    public ResourceLimits {
        if (maxMemoryMb <= 0 || maxCpuPercent <= 0 || maxExecutionTimeSecs <= 0 || maxConcurrentCommands <= 0) {
            throw new IllegalArgumentException("resource limits must be positive");
        }
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(1024, 80.0, 300, 5);
    }
}
