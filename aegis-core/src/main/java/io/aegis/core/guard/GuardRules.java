package io.aegis.core.guard;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable rule data evaluated by {@link CommandGuard}.
 *
 * @param allowedCommands   program names that may run; empty disables the allow-list
 * @param blockedCommands   program names that never run, even when allow-listed
 * @param protectedPaths    path prefixes no argument may point into
 * @param dangerousPatterns regexes searched in the joined command line, in order
 */
public record GuardRules(
    Set<String> allowedCommands,
    Set<String> blockedCommands,
    Set<String> protectedPaths,
    List<Pattern> dangerousPatterns
) {

    /** Programs refused by every enforcement layer unless an operator removes them at runtime. */
    public static final List<String> BUILT_IN_BLOCKED_COMMANDS = List.of(
        "rm", "rmdir", "del", "deltree", "format", "mkfs", "dd", "fdisk", "mount", "umount",
        "kill", "killall", "pkill", "killpg", "shutdown", "reboot", "halt", "poweroff",
        "iptables", "ufw", "firewall-cmd", "wget", "curl"
    );

    /** Destructive fragments searched in the joined command line by every enforcement layer. */
    public static final List<String> BUILT_IN_DANGEROUS_PATTERNS = List.of(
        "rm\\s+-rf\\s+/",
        "rm\\s+-rf\\s+\\*",
        ":\\s*\\(\\s*\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:",
        "os\\.fork",
        ">\\s*/dev/sd[a-z]",
        "\\bdd\\s+if=",
        "\\bmkfs\\b",
        "\\b(shutdown|reboot|halt|poweroff)\\b",
        "chmod\\s+777\\s+/",
        "chown\\s+root",
        "sudo\\s+.*rm",
        "&&",
        "\\|\\|",
        "\\|.*bash",
        "\\|.*sh",
        "curl.*\\|.*bash",
        "wget.*\\|.*sh",
        "\\beval\\s+",
        "\\bexec\\s+",
        "\\bsource\\s+"
    );

    public GuardRules {
        allowedCommands = copy(allowedCommands);
        blockedCommands = copy(blockedCommands);
        protectedPaths = copy(protectedPaths);
        dangerousPatterns = dangerousPatterns == null ? List.of() : List.copyOf(dangerousPatterns);
    }

    public static GuardRules of(
        Collection<String> allowedCommands,
        Collection<String> blockedCommands,
        Collection<String> protectedPaths,
        Collection<String> dangerousPatterns
    ) {
        return new GuardRules(
            copy(allowedCommands),
            copy(blockedCommands),
            copy(protectedPaths),
            compile(dangerousPatterns)
        );
    }

    public static List<Pattern> compile(Collection<String> regexes) {
        if (regexes == null || regexes.isEmpty()) {
            return List.of();
        }
        return regexes.stream()
            .filter(regex -> regex != null && !regex.isBlank())
            .map(GuardRules::compileOne)
            .toList();
    }

    private static Pattern compileOne(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid dangerous pattern: " + regex, e);
        }
    }

    private static Set<String> copy(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        LinkedHashSet<String> set = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                set.add(value.trim());
            }
        }
        return Set.copyOf(set);
    }
}
