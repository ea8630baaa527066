package io.aegis.core.policy;

/**
 * Resources a request asks for, compared by {@code RESOURCE_LIMIT} conditions.
 */
public record RequestedLimits(
    long maxMemoryMb,
    double maxCpuPercent,
    long maxExecutionTimeSecs,
    long maxOutputSize,
    int maxProcesses
) {

    public static RequestedLimits defaults() {
        return new RequestedLimits(256, 25.0, 30, 1024 * 1024, 1);
    }

    double valueOf(String field) {
        return switch (field) {
            case "memory" -> maxMemoryMb;
            case "cpu" -> maxCpuPercent;
            case "time" -> maxExecutionTimeSecs;
            case "output" -> maxOutputSize;
            case "processes" -> maxProcesses;
            default -> throw new IllegalArgumentException("Unknown resource field: " + field);
        };
    }
}
