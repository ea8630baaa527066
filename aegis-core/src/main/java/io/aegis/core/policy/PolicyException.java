package io.aegis.core.policy;

import java.util.Objects;

public final class PolicyException extends RuntimeException {
    private final Kind kind;

    private PolicyException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static PolicyException notFound(String policyId) {
        return new PolicyException(Kind.POLICY_NOT_FOUND, "Policy not found: " + policyId);
    }

    public static PolicyException invalid(String message) {
        return new PolicyException(Kind.INVALID_POLICY, "Invalid policy: " + message);
    }

    public static PolicyException evaluation(String message) {
        return new PolicyException(Kind.EVALUATION_ERROR, "Policy evaluation error: " + message);
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        POLICY_NOT_FOUND,
        INVALID_POLICY,
        EVALUATION_ERROR
    }
}
