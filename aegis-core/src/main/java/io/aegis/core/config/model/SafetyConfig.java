package io.aegis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.aegis.core.guard.GuardRules;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SafetyConfig(
    long commandIntervalMs,
    long apiIntervalMs,
    long maxMemoryMb,
    double maxCpuPercent,
    long maxExecutionTimeSecs,
    int maxConcurrentCommands,
    long maxOutputBytes,
    int historyCapacity,
    List<String> blockedCommands,
    List<String> blockedPaths,
    List<String> dangerousPatterns
) {

    public SafetyConfig {
        commandIntervalMs = Math.max(0, commandIntervalMs);
        apiIntervalMs = Math.max(0, apiIntervalMs);
        maxMemoryMb = maxMemoryMb <= 0 ? 1024 : maxMemoryMb;
        maxCpuPercent = maxCpuPercent <= 0 ? 80.0 : maxCpuPercent;
        maxExecutionTimeSecs = maxExecutionTimeSecs <= 0 ? 300 : maxExecutionTimeSecs;
        maxConcurrentCommands = maxConcurrentCommands <= 0 ? 5 : maxConcurrentCommands;
        maxOutputBytes = maxOutputBytes <= 0 ? 1024 * 1024 : maxOutputBytes;
        historyCapacity = historyCapacity <= 0 ? 1000 : historyCapacity;
        blockedCommands = blockedCommands == null ? List.of() : List.copyOf(blockedCommands);
        blockedPaths = blockedPaths == null ? List.of() : List.copyOf(blockedPaths);
        dangerousPatterns = dangerousPatterns == null ? List.of() : List.copyOf(dangerousPatterns);
    }

    // 100 commands/minute, 50 API calls/minute
    public static SafetyConfig defaults() {
        return new SafetyConfig(
            600,
            1200,
            1024,
            80.0,
            300,
            5,
            1024 * 1024,
            1000,
            GuardRules.BUILT_IN_BLOCKED_COMMANDS,
            List.of("/etc", "/sys", "/dev", "/proc", "/boot", "/", "~/.ssh", "~/.gnupg"),
            GuardRules.BUILT_IN_DANGEROUS_PATTERNS
        );
    }

    public SafetyConfig withCommandIntervalMs(long intervalMs) {
        return new SafetyConfig(intervalMs, apiIntervalMs, maxMemoryMb, maxCpuPercent, maxExecutionTimeSecs,
            maxConcurrentCommands, maxOutputBytes, historyCapacity, blockedCommands, blockedPaths, dangerousPatterns);
    }

    public SafetyConfig withMaxConcurrentCommands(int maxConcurrent) {
        return new SafetyConfig(commandIntervalMs, apiIntervalMs, maxMemoryMb, maxCpuPercent, maxExecutionTimeSecs,
            maxConcurrent, maxOutputBytes, historyCapacity, blockedCommands, blockedPaths, dangerousPatterns);
    }
}
