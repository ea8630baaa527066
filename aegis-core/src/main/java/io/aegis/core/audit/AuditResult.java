package io.aegis.core.audit;

public enum AuditResult {
    SUCCESS,
    FAILURE,
    WARNING
}
