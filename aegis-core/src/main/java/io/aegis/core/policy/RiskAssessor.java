package io.aegis.core.policy;

import java.util.Map;

public final class RiskAssessor {

    private RiskAssessor() {
    }

    public static RiskLevel assess(String toolName, Map<String, String> parameters) {
        String tool = toolName == null ? "" : toolName.trim();
        switch (tool) {
            case "file_write":
                if (parameters != null && parameters.values().stream().anyMatch(RiskAssessor::isSystemPath)) {
                    return RiskLevel.CRITICAL;
                }
                return RiskLevel.MEDIUM;
            case "process_list":
            case "directory_list":
            case "file_read":
                return RiskLevel.LOW;
            default:
                return RiskLevel.MEDIUM;
        }
    }

    private static boolean isSystemPath(String value) {
        return value != null && (value.startsWith("/etc") || value.startsWith("/sys"));
    }
}
