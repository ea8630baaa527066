package io.aegis.core.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record AuditEvent(
    String id,
    Instant timestamp,
    AuditSeverity severity,
    AuditEventType type,
    String operation,
    String resource,
    AuditResult result,
    String message,
    Map<String, Object> details
) {
    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        severity = severity == null ? AuditSeverity.LOW : severity;
        Objects.requireNonNull(type, "type must not be null");
        operation = operation == null ? "" : operation.trim();
        resource = resource == null ? "" : resource.trim();
        result = result == null ? AuditResult.SUCCESS : result;
        message = message == null ? "" : message.trim();
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * {@code [ts] SEVERITY TYPE OPERATION RESOURCE - RESULT: message {details}}
     */
    public String toLine() {
        StringBuilder line = new StringBuilder()
            .append('[').append(timestamp).append("] ")
            .append(severity).append(' ')
            .append(type).append(' ')
            .append(operation).append(' ')
            .append(resource).append(" - ")
            .append(result);
        if (!message.isEmpty()) {
            line.append(": ").append(message);
        }
        if (!details.isEmpty()) {
            line.append(' ').append(details);
        }
        return line.toString();
    }
}
