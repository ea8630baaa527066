package io.aegis.core.authorize;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages an authorized action passes through. Transitions only move forward.
 */
public enum ActionStage {
    PROPOSED,
    POLICY_CHECKED,
    DENIED,
    SANDBOX_VALIDATED,
    REJECTED,
    CONFIRMATION_PENDING,
    DECLINED,
    RATE_LIMITED,
    EXECUTING,
    TIMED_OUT,
    OUTPUT_TOO_LARGE,
    DANGEROUS_OUTPUT_DETECTED,
    FAILED,
    COMPLETED;

    public Set<ActionStage> successors() {
        return switch (this) {
            case PROPOSED -> EnumSet.of(POLICY_CHECKED);
            case POLICY_CHECKED -> EnumSet.of(DENIED, SANDBOX_VALIDATED);
            // confirmation is skipped when nothing asks for it
            case SANDBOX_VALIDATED -> EnumSet.of(REJECTED, CONFIRMATION_PENDING, RATE_LIMITED);
            case CONFIRMATION_PENDING -> EnumSet.of(DECLINED, RATE_LIMITED);
            // the safety layer re-validates before it spawns
            case RATE_LIMITED -> EnumSet.of(EXECUTING, REJECTED, FAILED);
            case EXECUTING -> EnumSet.of(TIMED_OUT, OUTPUT_TOO_LARGE, DANGEROUS_OUTPUT_DETECTED, FAILED, COMPLETED);
            default -> EnumSet.noneOf(ActionStage.class);
        };
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public boolean canAdvanceTo(ActionStage next) {
        return successors().contains(next);
    }
}
