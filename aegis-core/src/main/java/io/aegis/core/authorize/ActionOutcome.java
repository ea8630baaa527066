package io.aegis.core.authorize;

import io.aegis.core.exec.ProcessResult;
import io.aegis.core.guard.ErrorKind;
import io.aegis.core.policy.PolicyDecision;
import java.util.Objects;

/**
 * @param decision  the policy decision, or {@code null} when evaluation never happened
 * @param result    process output, present only when the command ran to exit
 * @param errorKind enforcement error that ended the action, or {@code null}
 */
public record ActionOutcome(
    ActionStage stage,
    String reason,
    PolicyDecision decision,
    ProcessResult result,
    ErrorKind errorKind
) {
    public ActionOutcome {
        Objects.requireNonNull(stage, "stage must not be null");
        reason = reason == null ? "" : reason;
    }

    public boolean completed() {
        return stage == ActionStage.COMPLETED;
    }
}
