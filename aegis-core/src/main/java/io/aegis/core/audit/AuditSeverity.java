package io.aegis.core.audit;

public enum AuditSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
