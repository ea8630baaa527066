package io.aegis.core.safety;

import java.time.Instant;

public record SystemStats(
    long totalCommandsExecuted,
    long totalCommandsBlocked,
    int activeCommands,
    long memoryUsageMb,
    double cpuUsagePercent,
    Instant lastUpdated
) {
}
