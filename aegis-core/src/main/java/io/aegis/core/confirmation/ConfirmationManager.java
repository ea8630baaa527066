package io.aegis.core.confirmation;

import java.util.List;
import java.util.Locale;

/**
 * Decides which operations need a human "yes" before they run. Holds no per-request state.
 */
public final class ConfirmationManager {
    static final List<String> DESTRUCTIVE_VERBS = List.of(
        "delete", "remove", "rm", "uninstall", "drop", "destroy", "format", "wipe",
        "clean", "purge", "truncate", "overwrite", "replace", "modify", "edit", "update"
    );
    static final List<String> SYSTEM_DIRECTORIES = List.of("/etc/", "/sys/", "/dev/", "/proc/");
    static final List<String> SENSITIVE_EXTENSIONS = List.of(".db", ".sql", ".key", ".pem", ".crt", ".conf", ".config");

    private volatile boolean requireConfirmation;

    public ConfirmationManager() {
        this(true);
    }

    public ConfirmationManager(boolean requireConfirmation) {
        this.requireConfirmation = requireConfirmation;
    }

    public boolean requiresConfirmation(String operation, String target) {
        if (!requireConfirmation) {
            return false;
        }
        String op = operation == null ? "" : operation.toLowerCase(Locale.ROOT);
        String path = target == null ? "" : target.toLowerCase(Locale.ROOT);
        if (DESTRUCTIVE_VERBS.stream().anyMatch(op::contains)) {
            return true;
        }
        if (SYSTEM_DIRECTORIES.stream().anyMatch(path::contains)) {
            return true;
        }
        return SENSITIVE_EXTENSIONS.stream().anyMatch(path::endsWith);
    }

    public String getConfirmationPrompt(String operation, String target) {
        return "WARNING: This operation may be destructive!\n\n"
            + "Operation: " + operation + "\n"
            + "Target: " + target + "\n\n"
            + "Are you sure you want to proceed? (type 'yes' to confirm): ";
    }

    public boolean validateConfirmation(String response) {
        return response != null && "yes".equals(response.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isRequireConfirmation() {
        return requireConfirmation;
    }

    public void setRequireConfirmation(boolean requireConfirmation) {
        this.requireConfirmation = requireConfirmation;
    }
}
