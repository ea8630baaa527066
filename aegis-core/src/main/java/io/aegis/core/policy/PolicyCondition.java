package io.aegis.core.policy;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One test against a {@link PolicyRequest}. {@code value} carries the primary operand;
 * {@code operand} is used by the two-operand kinds ({@code RESOURCE_LIMIT} holds the
 * comparison, {@code TIME_OF_DAY} the window end).
 */
public record PolicyCondition(Kind kind, String value, String operand) {
    static final Set<String> RESOURCE_FIELDS = Set.of("memory", "cpu", "time", "output", "processes");
    static final Set<String> OPERATORS = Set.of(">", "<", ">=", "<=", "==", "!=");

    public PolicyCondition {
        Objects.requireNonNull(kind, "kind must not be null");
        value = value == null ? "" : value.trim();
        operand = operand == null ? "" : operand.trim();
    }

    public static PolicyCondition userId(String userId) {
        return new PolicyCondition(Kind.USER_ID, userId, null);
    }

    public static PolicyCondition toolName(String toolName) {
        return new PolicyCondition(Kind.TOOL_NAME, toolName, null);
    }

    public static PolicyCondition commandPattern(String fragment) {
        return new PolicyCondition(Kind.COMMAND_PATTERN, fragment, null);
    }

    public static PolicyCondition resourceLimit(String field, String comparison) {
        return new PolicyCondition(Kind.RESOURCE_LIMIT, field, comparison);
    }

    public static PolicyCondition timeOfDay(String start, String end) {
        return new PolicyCondition(Kind.TIME_OF_DAY, start, end);
    }

    public static PolicyCondition networkAccess(boolean required) {
        return new PolicyCondition(Kind.NETWORK_ACCESS, Boolean.toString(required), null);
    }

    public static PolicyCondition filePath(String prefix) {
        return new PolicyCondition(Kind.FILE_PATH, prefix, null);
    }

    public static PolicyCondition containsSecrets(boolean required) {
        return new PolicyCondition(Kind.CONTAINS_SECRETS, Boolean.toString(required), null);
    }

    public static PolicyCondition riskLevel(RiskLevel level) {
        return new PolicyCondition(Kind.RISK_LEVEL, level.label(), null);
    }

    /**
     * Rejects operands the evaluator could never match.
     */
    void validate(String policyId) {
        switch (kind) {
            case USER_ID, TOOL_NAME, COMMAND_PATTERN, FILE_PATH -> {
                if (value.isEmpty()) {
                    throw PolicyException.invalid(policyId + ": " + kind + " needs a value");
                }
            }
            case NETWORK_ACCESS, CONTAINS_SECRETS -> {
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw PolicyException.invalid(policyId + ": " + kind + " expects true or false, got '" + value + "'");
                }
            }
            case RISK_LEVEL -> {
                try {
                    RiskLevel.fromLabel(value);
                } catch (IllegalArgumentException e) {
                    throw PolicyException.invalid(policyId + ": unknown risk level '" + value + "'");
                }
            }
            case RESOURCE_LIMIT -> {
                if (!RESOURCE_FIELDS.contains(value.toLowerCase(Locale.ROOT))) {
                    throw PolicyException.invalid(policyId + ": unknown resource field '" + value + "'");
                }
                String[] parts = operand.split("\\s+");
                if (parts.length != 2 || !OPERATORS.contains(parts[0])) {
                    throw PolicyException.invalid(policyId + ": resource limit must look like '<op> <number>', got '" + operand + "'");
                }
                try {
                    Double.parseDouble(parts[1]);
                } catch (NumberFormatException e) {
                    throw PolicyException.invalid(policyId + ": resource limit threshold is not a number: '" + parts[1] + "'");
                }
            }
            case TIME_OF_DAY -> {
                try {
                    LocalTime.parse(value);
                    LocalTime.parse(operand);
                } catch (DateTimeParseException e) {
                    throw PolicyException.invalid(policyId + ": time window must be HH:mm, got '" + value + "'-'" + operand + "'");
                }
            }
            default -> throw PolicyException.invalid(policyId + ": unsupported condition " + kind);
        }
    }

    public enum Kind {
        USER_ID,
        TOOL_NAME,
        COMMAND_PATTERN,
        RESOURCE_LIMIT,
        TIME_OF_DAY,
        NETWORK_ACCESS,
        FILE_PATH,
        CONTAINS_SECRETS,
        RISK_LEVEL
    }
}
