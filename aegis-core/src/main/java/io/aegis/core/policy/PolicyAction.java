package io.aegis.core.policy;

import java.util.Objects;

/**
 * Outcome a matching policy contributes. {@link Type#severity()} orders outcomes when several
 * policies match: a decision only ever moves to a more severe type.
 */
public record PolicyAction(Type type, String reason) {

    public PolicyAction {
        Objects.requireNonNull(type, "type must not be null");
        reason = reason == null ? "" : reason.trim();
    }

    public static PolicyAction allow() {
        return new PolicyAction(Type.ALLOW, "");
    }

    public static PolicyAction deny(String reason) {
        return new PolicyAction(Type.DENY, reason);
    }

    public static PolicyAction requireApproval(String reason) {
        return new PolicyAction(Type.REQUIRE_APPROVAL, reason);
    }

    public static PolicyAction escalate(String reason) {
        return new PolicyAction(Type.ESCALATE, reason);
    }

    public static PolicyAction logOnly() {
        return new PolicyAction(Type.LOG_ONLY, "");
    }

    public boolean permitsExecution() {
        return type != Type.DENY;
    }

    public boolean needsApproval() {
        return type == Type.REQUIRE_APPROVAL || type == Type.ESCALATE;
    }

    public enum Type {
        ALLOW(0),
        LOG_ONLY(1),
        REQUIRE_APPROVAL(2),
        ESCALATE(3),
        DENY(4);

        private final int severity;

        Type(int severity) {
            this.severity = severity;
        }

        public int severity() {
            return severity;
        }

        public boolean requiresReason() {
            return this == DENY || this == REQUIRE_APPROVAL || this == ESCALATE;
        }
    }
}
