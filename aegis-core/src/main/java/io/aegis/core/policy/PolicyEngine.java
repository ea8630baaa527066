package io.aegis.core.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declarative decision point. Policies are walked by descending priority; a matching deny
 * ends the walk and any other match can only make the decision more severe.
 */
public final class PolicyEngine {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyEngine.class);
    private static final Comparator<SecurityPolicy> BY_PRIORITY =
        Comparator.comparingInt(SecurityPolicy::priority).reversed();

    private final Clock clock;
    private final ObjectMapper mapper;
    private final PolicyAuditLog auditLog;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<SecurityPolicy> policies = new ArrayList<>();

    public PolicyEngine() {
        this(Clock.systemDefaultZone());
    }

    public PolicyEngine(Clock clock) {
        this(builtInPolicies(), clock, new PolicyAuditLog());
    }

    public PolicyEngine(List<SecurityPolicy> initialPolicies, Clock clock, PolicyAuditLog auditLog) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (initialPolicies != null) {
            for (SecurityPolicy policy : initialPolicies) {
                validate(policy);
                policies.add(policy);
            }
            policies.sort(BY_PRIORITY);
        }
    }

    public static List<SecurityPolicy> builtInPolicies() {
        return List.of(
            new SecurityPolicy(
                "block_dangerous_commands",
                "Block Dangerous Commands",
                "Block potentially destructive commands",
                List.of(
                    PolicyCondition.commandPattern("rm -rf /"),
                    PolicyCondition.commandPattern("mkfs"),
                    PolicyCondition.commandPattern("dd if="),
                    PolicyCondition.commandPattern("shutdown"),
                    PolicyCondition.commandPattern("reboot")
                ),
                PolicyAction.deny("Command contains destructive operations"),
                100,
                true
            ),
            new SecurityPolicy(
                "secrets_deny",
                "Deny Operations with Secrets",
                "Block operations that contain sensitive information",
                List.of(PolicyCondition.containsSecrets(true)),
                PolicyAction.deny("Operation contains sensitive information"),
                95,
                true
            ),
            new SecurityPolicy(
                "high_risk_requires_approval",
                "High Risk Requires Approval",
                "High-risk operations require explicit approval",
                List.of(PolicyCondition.riskLevel(RiskLevel.HIGH), PolicyCondition.riskLevel(RiskLevel.CRITICAL)),
                PolicyAction.requireApproval("High-risk operation detected"),
                90,
                true
            ),
            new SecurityPolicy(
                "system_paths_protection",
                "System Paths Protection",
                "Protect system directories from modification",
                List.of(
                    PolicyCondition.filePath("/etc"),
                    PolicyCondition.filePath("/sys"),
                    PolicyCondition.filePath("/dev"),
                    PolicyCondition.filePath("/proc"),
                    PolicyCondition.filePath("/root")
                ),
                PolicyAction.deny("Access to system directories is not allowed"),
                85,
                true
            ),
            new SecurityPolicy(
                "resource_limits",
                "Enforce Resource Limits",
                "Ensure resource usage stays within safe limits",
                List.of(
                    PolicyCondition.resourceLimit("memory", "> 1024"),
                    PolicyCondition.resourceLimit("cpu", "> 80")
                ),
                PolicyAction.deny("Resource limits exceed safe thresholds"),
                80,
                true
            ),
            new SecurityPolicy(
                "network_restrictions",
                "Network Access Restrictions",
                "Log network access for monitoring",
                List.of(PolicyCondition.networkAccess(true)),
                PolicyAction.logOnly(),
                70,
                true
            )
        );
    }

    /**
     * Never fails: a request no policy matches is allowed by default. Every call is appended
     * to the audit log.
     */
    public PolicyDecision evaluate(PolicyRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String auditId = "audit_" + UUID.randomUUID();
        List<String> applied = new ArrayList<>();
        PolicyAction action = PolicyAction.allow();
        String reason = "Request allowed by default policy";

        lock.readLock().lock();
        try {
            for (SecurityPolicy policy : policies) {
                if (!policy.enabled() || !matches(request, policy)) {
                    continue;
                }
                applied.add(policy.id());
                PolicyAction candidate = policy.action();
                if (candidate.type().severity() <= action.type().severity()) {
                    continue;
                }
                action = candidate;
                reason = switch (candidate.type()) {
                    case DENY -> "Policy '" + policy.name() + "' denied request: " + candidate.reason();
                    case ESCALATE -> "Policy '" + policy.name() + "' escalated request: " + candidate.reason();
                    case REQUIRE_APPROVAL -> "Policy '" + policy.name() + "' requires approval: " + candidate.reason();
                    case LOG_ONLY -> "Policy '" + policy.name() + "' logged request";
                    case ALLOW -> reason;
                };
                if (action.type() == PolicyAction.Type.DENY) {
                    break;
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        PolicyDecision decision = new PolicyDecision(action, reason, applied, auditId);
        auditLog.append(new PolicyAuditEntry(auditId, clock.instant(), request, decision));
        LOG.debug("Policy decision {} for tool '{}' (matched {}): {}",
            action.type(), request.toolName(), applied, reason);
        return decision;
    }

    /**
     * Builds a request for a tool invocation, deriving the risk level from the tool name and
     * parameters, and evaluates it.
     */
    public PolicyDecision evaluateToolRequest(
        String toolName,
        Map<String, String> parameters,
        RequestedLimits limits,
        boolean containsSecrets,
        boolean networkAccess,
        List<String> filePaths
    ) {
        if (toolName == null || toolName.isBlank()) {
            throw PolicyException.evaluation("tool name must not be blank");
        }
        Map<String, String> params = parameters == null ? Map.of() : parameters;
        PolicyRequest request = PolicyRequest.builder(toolName)
            .parameters(params)
            .resourceLimits(limits)
            .containsSecrets(containsSecrets)
            .networkAccess(networkAccess)
            .filePaths(filePaths == null ? List.of() : filePaths)
            .riskAssessment(RiskAssessor.assess(toolName, params))
            .build();
        return evaluate(request);
    }

    public void addPolicy(SecurityPolicy policy) {
        validate(policy);
        lock.writeLock().lock();
        try {
            if (indexOf(policy.id()) >= 0) {
                throw PolicyException.invalid("duplicate policy id '" + policy.id() + "'");
            }
            policies.add(policy);
            policies.sort(BY_PRIORITY);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Added policy '{}' with priority {}", policy.id(), policy.priority());
    }

    public void removePolicy(String policyId) {
        lock.writeLock().lock();
        try {
            int index = indexOf(policyId);
            if (index < 0) {
                throw PolicyException.notFound(policyId);
            }
            policies.remove(index);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Removed policy '{}'", policyId);
    }

    public void setPolicyEnabled(String policyId, boolean enabled) {
        lock.writeLock().lock();
        try {
            int index = indexOf(policyId);
            if (index < 0) {
                throw PolicyException.notFound(policyId);
            }
            policies.set(index, policies.get(index).withEnabled(enabled));
            policies.sort(BY_PRIORITY);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Policy '{}' {}", policyId, enabled ? "enabled" : "disabled");
    }

    /**
     * Snapshot in evaluation order.
     */
    public List<SecurityPolicy> policies() {
        lock.readLock().lock();
        try {
            return List.copyOf(policies);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PolicyAuditEntry> auditTrail() {
        return auditLog.snapshot();
    }

    /**
     * One JSON object per line, oldest first.
     */
    public String exportAuditLog() {
        StringBuilder out = new StringBuilder();
        for (PolicyAuditEntry entry : auditLog.snapshot()) {
            try {
                out.append(mapper.writeValueAsString(entry)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize policy audit entry " + entry.id(), e);
            }
        }
        return out.toString();
    }

    boolean matches(PolicyRequest request, SecurityPolicy policy) {
        for (PolicyCondition condition : policy.conditions()) {
            if (conditionMatches(request, condition)) {
                return true;
            }
        }
        return false;
    }

    boolean conditionMatches(PolicyRequest request, PolicyCondition condition) {
        String value = condition.value();
        return switch (condition.kind()) {
            case USER_ID -> value.equals(request.userId());
            case TOOL_NAME -> value.equals(request.toolName());
            case COMMAND_PATTERN -> request.parameters().values().stream()
                .anyMatch(parameter -> parameter != null && parameter.contains(value));
            case RESOURCE_LIMIT -> resourceLimitMatches(request.resourceLimits(), value, condition.operand());
            case TIME_OF_DAY -> withinWindow(value, condition.operand());
            case NETWORK_ACCESS -> request.networkAccess() == Boolean.parseBoolean(value);
            case FILE_PATH -> request.filePaths().stream().anyMatch(path -> path != null && path.startsWith(value));
            case CONTAINS_SECRETS -> request.containsSecrets() == Boolean.parseBoolean(value);
            case RISK_LEVEL -> request.riskAssessment().label().equalsIgnoreCase(value);
        };
    }

    private static boolean resourceLimitMatches(RequestedLimits limits, String field, String comparison) {
        String[] parts = comparison.trim().split("\\s+");
        if (parts.length != 2) {
            return false;
        }
        double threshold;
        double actual;
        try {
            threshold = Double.parseDouble(parts[1]);
            actual = limits.valueOf(field.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return switch (parts[0]) {
            case ">" -> actual > threshold;
            case "<" -> actual < threshold;
            case ">=" -> actual >= threshold;
            case "<=" -> actual <= threshold;
            case "==" -> Math.abs(actual - threshold) < Math.ulp(threshold);
            case "!=" -> Math.abs(actual - threshold) >= Math.ulp(threshold);
            default -> false;
        };
    }

    // the window may wrap midnight, e.g. 22:00-06:00
    private boolean withinWindow(String start, String end) {
        LocalTime from;
        LocalTime to;
        try {
            from = LocalTime.parse(start);
            to = LocalTime.parse(end);
        } catch (DateTimeParseException e) {
            return false;
        }
        LocalTime now = LocalTime.now(clock);
        if (from.equals(to)) {
            return true;
        }
        if (from.isBefore(to)) {
            return !now.isBefore(from) && now.isBefore(to);
        }
        return !now.isBefore(from) || now.isBefore(to);
    }

    private int indexOf(String policyId) {
        for (int i = 0; i < policies.size(); i++) {
            if (policies.get(i).id().equals(policyId)) {
                return i;
            }
        }
        return -1;
    }

    private static void validate(SecurityPolicy policy) {
        if (policy == null) {
            throw PolicyException.invalid("policy must not be null");
        }
        if (policy.id().isEmpty()) {
            throw PolicyException.invalid("policy id must not be blank");
        }
        if (policy.action() == null) {
            throw PolicyException.invalid(policy.id() + ": action must not be null");
        }
        if (policy.conditions().isEmpty()) {
            throw PolicyException.invalid(policy.id() + ": at least one condition is required");
        }
        if (policy.action().type().requiresReason() && policy.action().reason().isEmpty()) {
            throw PolicyException.invalid(policy.id() + ": " + policy.action().type() + " needs a reason");
        }
        for (PolicyCondition condition : policy.conditions()) {
            if (condition == null) {
                throw PolicyException.invalid(policy.id() + ": condition must not be null");
            }
            condition.validate(policy.id());
        }
    }
}
