package io.aegis.core.policy;

import java.time.Instant;

public record PolicyAuditEntry(String id, Instant timestamp, PolicyRequest request, PolicyDecision decision) {
}
