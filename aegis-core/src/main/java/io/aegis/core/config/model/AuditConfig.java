package io.aegis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    boolean enabled,
    String directory,
    boolean structuredLogging,
    int maxFiles,
    long maxFileSizeMb
) {

    public AuditConfig {
        directory = directory == null || directory.isBlank() ? "~/.aegis/audit" : directory.trim();
        maxFiles = maxFiles <= 0 ? 10 : maxFiles;
        maxFileSizeMb = maxFileSizeMb <= 0 ? 100 : maxFileSizeMb;
    }

    public static AuditConfig defaults() {
        return new AuditConfig(false, "~/.aegis/audit", true, 10, 100);
    }
}
