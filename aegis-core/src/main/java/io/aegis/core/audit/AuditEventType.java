package io.aegis.core.audit;

public enum AuditEventType {
    AUTHORIZATION,
    SECURITY_EVENT,
    CONFIGURATION_CHANGE,
    COMMAND_EXECUTION
}
