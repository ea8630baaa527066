package io.aegis.core.authorize;

import io.aegis.core.audit.AuditEventType;
import io.aegis.core.audit.AuditResult;
import io.aegis.core.audit.AuditSeverity;
import io.aegis.core.audit.AuditTrail;
import io.aegis.core.confirmation.ConfirmationManager;
import io.aegis.core.confirmation.ConfirmationPort;
import io.aegis.core.exec.ProcessResult;
import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import io.aegis.core.middleware.SecretsDetector;
import io.aegis.core.policy.PolicyDecision;
import io.aegis.core.policy.PolicyEngine;
import io.aegis.core.policy.PolicyRequest;
import io.aegis.core.safety.SafetyManager;
import io.aegis.core.sandbox.Sandbox;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a proposed command through every layer in order: policy decision, sandbox validation,
 * human confirmation, then throttled and resource-checked execution with output inspection.
 * Each layer can end the action; nothing is retried. Every outcome is written to the audit
 * trail.
 */
public final class ActionAuthorizer {
    private static final Logger LOG = LoggerFactory.getLogger(ActionAuthorizer.class);

    private final PolicyEngine policyEngine;
    private final Sandbox sandbox;
    private final SafetyManager safetyManager;
    private final ConfirmationManager confirmationManager;
    private final SecretsDetector secretsDetector;
    private final AuditTrail auditTrail;

    public ActionAuthorizer(
        PolicyEngine policyEngine,
        Sandbox sandbox,
        SafetyManager safetyManager,
        ConfirmationManager confirmationManager,
        SecretsDetector secretsDetector,
        AuditTrail auditTrail
    ) {
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.safetyManager = Objects.requireNonNull(safetyManager, "safetyManager must not be null");
        this.confirmationManager = Objects.requireNonNull(confirmationManager, "confirmationManager must not be null");
        this.secretsDetector = Objects.requireNonNull(secretsDetector, "secretsDetector must not be null");
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    }

    public ActionOutcome authorize(ActionRequest request, ConfirmationPort confirmationPort) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(confirmationPort, "confirmationPort must not be null");
        Progress progress = new Progress(request);

        PolicyDecision decision = evaluate(request);
        progress.advance(ActionStage.POLICY_CHECKED);
        if (decision.isDenied()) {
            return finish(progress.advance(ActionStage.DENIED), request, decision.reason(), decision, null, null);
        }

        try {
            sandbox.validateCommand(request.program(), request.args());
        } catch (CommandRejectedException e) {
            progress.advance(ActionStage.SANDBOX_VALIDATED);
            return finish(progress.advance(ActionStage.REJECTED), request, e.reason(), decision, null, e.kind());
        }
        progress.advance(ActionStage.SANDBOX_VALIDATED);

        if (needsConfirmation(request, decision)) {
            progress.advance(ActionStage.CONFIRMATION_PENDING);
            String prompt = confirmationManager.getConfirmationPrompt(request.commandLine(), confirmationTarget(request));
            String answer = confirmationPort.requestConfirmation(prompt);
            if (!confirmationManager.validateConfirmation(answer)) {
                return finish(progress.advance(ActionStage.DECLINED), request, "Operation declined by user", decision, null, null);
            }
        }

        progress.advance(ActionStage.RATE_LIMITED);
        ProcessResult result;
        try {
            result = safetyManager.executeSafeCommand(request.program(), request.args(), request.userId());
        } catch (CommandRejectedException e) {
            if (reachedExecution(e.kind())) {
                progress.advance(ActionStage.EXECUTING);
            }
            return finish(progress.advance(terminalFor(e.kind())), request, e.reason(), decision, null, e.kind());
        }
        progress.advance(ActionStage.EXECUTING);

        if (!result.succeeded()) {
            String reason = "Command exited with code " + result.exitCode();
            return finish(progress.advance(ActionStage.FAILED), request, reason, decision, result, ErrorKind.EXECUTION_FAILED);
        }
        return finish(progress.advance(ActionStage.COMPLETED), request, decision.reason(), decision, result, null);
    }

    /**
     * Dry run: policy and both validation layers, no confirmation and no execution. Ends in
     * {@link ActionStage#DENIED}, {@link ActionStage#REJECTED}, {@link ActionStage#CONFIRMATION_PENDING}
     * when a human would be asked, or {@link ActionStage#SANDBOX_VALIDATED} when the command
     * could run straight away.
     */
    public ActionOutcome assess(ActionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        PolicyDecision decision = evaluate(request);
        if (decision.isDenied()) {
            return new ActionOutcome(ActionStage.DENIED, decision.reason(), decision, null, null);
        }
        Optional<CommandRejectedException> violation = sandbox.testCommand(request.program(), request.args());
        if (violation.isEmpty()) {
            try {
                safetyManager.checkCommand(request.program(), request.args());
            } catch (CommandRejectedException e) {
                violation = Optional.of(e);
            }
        }
        if (violation.isPresent()) {
            CommandRejectedException e = violation.get();
            return new ActionOutcome(ActionStage.REJECTED, e.reason(), decision, null, e.kind());
        }
        if (needsConfirmation(request, decision)) {
            return new ActionOutcome(ActionStage.CONFIRMATION_PENDING, "Confirmation required", decision, null, null);
        }
        return new ActionOutcome(ActionStage.SANDBOX_VALIDATED, decision.reason(), decision, null, null);
    }

    private PolicyDecision evaluate(ActionRequest request) {
        PolicyRequest policyRequest = PolicyRequests.from(request, secretsDetector);
        return policyEngine.evaluate(policyRequest);
    }

    private boolean needsConfirmation(ActionRequest request, PolicyDecision decision) {
        if (decision.action().needsApproval()) {
            return true;
        }
        String operation = request.commandLine();
        List<String> targets = request.args().isEmpty() ? List.of("") : request.args();
        return targets.stream().anyMatch(target -> confirmationManager.requiresConfirmation(operation, target));
    }

    private static String confirmationTarget(ActionRequest request) {
        return request.args().isEmpty() ? request.program() : String.join(" ", request.args());
    }

    // validation, throttling and resource refusals happen before anything is spawned
    private static boolean reachedExecution(ErrorKind kind) {
        return !kind.isValidation() && kind != ErrorKind.RATE_LIMITED && kind != ErrorKind.RESOURCE_EXCEEDED;
    }

    static ActionStage terminalFor(ErrorKind kind) {
        if (kind.isValidation()) {
            return ActionStage.REJECTED;
        }
        return switch (kind) {
            case TIMEOUT -> ActionStage.TIMED_OUT;
            case OUTPUT_TOO_LARGE -> ActionStage.OUTPUT_TOO_LARGE;
            case DANGEROUS_OUTPUT -> ActionStage.DANGEROUS_OUTPUT_DETECTED;
            default -> ActionStage.FAILED;
        };
    }

    private ActionOutcome finish(
        ActionStage stage,
        ActionRequest request,
        String reason,
        PolicyDecision decision,
        ProcessResult result,
        ErrorKind errorKind
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("user", request.userId());
        details.put("tool", request.toolName());
        details.put("stage", stage.name());
        if (decision != null) {
            details.put("decision", decision.action().type().name());
            details.put("applied_policies", String.join(",", decision.appliedPolicies()));
            details.put("policy_audit_id", decision.auditId());
        }
        if (errorKind != null) {
            details.put("error", errorKind.label());
        }
        if (result != null) {
            details.put("exit_code", result.exitCode());
            details.put("duration_ms", result.durationMs());
        }
        auditTrail.record(
            severityOf(stage),
            typeOf(stage),
            "authorize_action",
            request.commandLine(),
            resultOf(stage),
            reason,
            details
        );
        if (stage == ActionStage.COMPLETED) {
            LOG.info("Action '{}' for {} completed", request.commandLine(), request.userId());
        } else {
            LOG.warn("Action '{}' for {} ended in {}: {}", request.commandLine(), request.userId(), stage, reason);
        }
        return new ActionOutcome(stage, reason, decision, result, errorKind);
    }

    private static AuditSeverity severityOf(ActionStage stage) {
        return switch (stage) {
            case COMPLETED -> AuditSeverity.LOW;
            case DECLINED, TIMED_OUT, OUTPUT_TOO_LARGE, FAILED -> AuditSeverity.MEDIUM;
            case DANGEROUS_OUTPUT_DETECTED -> AuditSeverity.CRITICAL;
            default -> AuditSeverity.HIGH;
        };
    }

    private static AuditEventType typeOf(ActionStage stage) {
        return switch (stage) {
            case DENIED, DECLINED -> AuditEventType.AUTHORIZATION;
            case REJECTED, DANGEROUS_OUTPUT_DETECTED -> AuditEventType.SECURITY_EVENT;
            default -> AuditEventType.COMMAND_EXECUTION;
        };
    }

    private static AuditResult resultOf(ActionStage stage) {
        return switch (stage) {
            case COMPLETED -> AuditResult.SUCCESS;
            case DECLINED -> AuditResult.WARNING;
            default -> AuditResult.FAILURE;
        };
    }

    private static final class Progress {
        private final ActionRequest request;
        private ActionStage stage = ActionStage.PROPOSED;

        private Progress(ActionRequest request) {
            this.request = request;
        }

        private ActionStage advance(ActionStage next) {
            if (!stage.canAdvanceTo(next)) {
                throw new IllegalStateException("Illegal transition " + stage + " -> " + next);
            }
            LOG.debug("Action '{}': {} -> {}", request.commandLine(), stage, next);
            stage = next;
            return next;
        }
    }
}
