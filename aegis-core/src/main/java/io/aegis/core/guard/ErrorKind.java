package io.aegis.core.guard;

/**
 * Closed set of reasons a command can be refused or fail under enforcement.
 */
public enum ErrorKind {
    BLOCKED_COMMAND("blocked-command"),
    NOT_WHITELISTED("not-in-allowlist"),
    DANGEROUS_PATTERN("dangerous-pattern"),
    BLOCKED_PATH("blocked-path"),
    SHELL_METACHARACTER("shell-metacharacter"),
    EMPTY_COMMAND("empty-command"),
    OUTPUT_TOO_LARGE("output-too-large"),
    DANGEROUS_OUTPUT("dangerous-output"),
    TIMEOUT("timeout"),
    RATE_LIMITED("rate-limited"),
    RESOURCE_EXCEEDED("resource-exceeded"),
    EXECUTION_FAILED("execution-failed"),
    CANCELLED("cancelled");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * True for kinds raised before any process was spawned.
     */
    public boolean isValidation() {
        return switch (this) {
            case BLOCKED_COMMAND, NOT_WHITELISTED, DANGEROUS_PATTERN, BLOCKED_PATH, SHELL_METACHARACTER, EMPTY_COMMAND -> true;
            default -> false;
        };
    }
}
