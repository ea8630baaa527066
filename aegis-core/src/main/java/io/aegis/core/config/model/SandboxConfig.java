package io.aegis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.aegis.core.guard.GuardRules;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SandboxConfig(
    List<String> allowedCommands,
    List<String> blockedCommands,
    List<String> allowedPaths,
    List<String> blockedPaths,
    List<String> dangerousPatterns,
    long maxExecutionTimeSecs,
    long maxOutputBytes
) {

    public SandboxConfig {
        allowedCommands = allowedCommands == null ? List.of() : List.copyOf(allowedCommands);
        blockedCommands = blockedCommands == null ? List.of() : List.copyOf(blockedCommands);
        allowedPaths = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
        blockedPaths = blockedPaths == null ? List.of() : List.copyOf(blockedPaths);
        dangerousPatterns = dangerousPatterns == null ? List.of() : List.copyOf(dangerousPatterns);
        maxExecutionTimeSecs = maxExecutionTimeSecs <= 0 ? 30 : maxExecutionTimeSecs;
        maxOutputBytes = maxOutputBytes <= 0 ? 1024 * 1024 : maxOutputBytes;
    }

    public static SandboxConfig defaults() {
        return new SandboxConfig(
            List.of(
                // inspection and text tools
                "ls", "cat", "grep", "find", "head", "tail", "wc", "sort", "uniq", "pwd", "echo", "bash",
                // development
                "cargo", "rustc", "npm", "node", "python", "python3", "pip", "pip3", "git", "make", "cmake",
                // read-only system monitoring
                "ps", "top", "htop", "df", "du", "free", "uptime", "whoami", "id", "date", "systemctl",
                "journalctl", "hostname", "uname", "lsblk", "blkid", "fdisk", "parted", "lscpu", "lspci",
                "lsusb", "dmidecode", "sensors", "iostat", "vmstat", "sar", "sysctl", "sudo"
            ),
            GuardRules.BUILT_IN_BLOCKED_COMMANDS,
            List.of("/usr/bin", "/bin", "/usr/local/bin", "/home", "/tmp", "/var/log"),
            List.of("/etc", "/sys", "/dev", "/proc", "/boot", "/root", "/usr/sbin"),
            GuardRules.BUILT_IN_DANGEROUS_PATTERNS,
            30,
            1024 * 1024
        );
    }
}
