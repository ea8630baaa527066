package io.aegis.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * @param appliedPolicies ids of every matched policy, in evaluation order
 */
public record PolicyDecision(PolicyAction action, String reason, List<String> appliedPolicies, String auditId) {

    public PolicyDecision {
        Objects.requireNonNull(action, "action must not be null");
        reason = reason == null ? "" : reason;
        appliedPolicies = appliedPolicies == null ? List.of() : List.copyOf(appliedPolicies);
    }

    @JsonIgnore
    public boolean isDenied() {
        return action.type() == PolicyAction.Type.DENY;
    }
}
