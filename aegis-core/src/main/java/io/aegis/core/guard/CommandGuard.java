package io.aegis.core.guard;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation predicate shared by the sandbox and the safety manager. Both layers keep their
 * own {@link GuardRules}; only the checking logic lives here.
 */
public final class CommandGuard {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s;|&()`'\"]+");

    private CommandGuard() {
    }

    public static void check(GuardRules rules, String program, List<String> args) throws CommandRejectedException {
        Optional<CommandRejectedException> violation = findViolation(rules, program, args);
        if (violation.isPresent()) {
            throw violation.get();
        }
    }

    public static Optional<CommandRejectedException> findViolation(GuardRules rules, String program, List<String> args) {
        String command = program == null ? "" : program.trim();
        List<String> arguments = args == null ? List.of() : args;
        if (command.isEmpty()) {
            return reject(ErrorKind.EMPTY_COMMAND, "Empty command");
        }

        String name = commandName(command);
        if (rules.blockedCommands().contains(command) || rules.blockedCommands().contains(name)) {
            return reject(ErrorKind.BLOCKED_COMMAND, "Command '" + name + "' is blocked for security reasons");
        }
        if (!rules.allowedCommands().isEmpty()
            && !rules.allowedCommands().contains(command)
            && !rules.allowedCommands().contains(name)) {
            return reject(ErrorKind.NOT_WHITELISTED, "Command '" + name + "' is not in the allowed commands list");
        }

        for (String arg : arguments) {
            Optional<String> nested = blockedWord(rules, arg);
            if (nested.isPresent()) {
                return reject(ErrorKind.BLOCKED_COMMAND, "Command '" + nested.get() + "' is blocked for security reasons");
            }
        }

        String fullCommand = joinCommandLine(command, arguments);
        for (Pattern pattern : rules.dangerousPatterns()) {
            if (pattern.matcher(fullCommand).find()) {
                return reject(ErrorKind.DANGEROUS_PATTERN, "Command matches dangerous pattern: " + pattern.pattern());
            }
        }

        List<String> candidates = new ArrayList<>();
        if (looksLikePath(command)) {
            candidates.add(command);
        }
        for (String arg : arguments) {
            if (arg == null) {
                continue;
            }
            if (looksLikePath(arg)) {
                candidates.add(arg);
            }
            int eq = arg.indexOf('=');
            if (eq >= 0 && looksLikePath(arg.substring(eq + 1))) {
                candidates.add(arg.substring(eq + 1));
            }
        }
        for (String candidate : candidates) {
            Optional<String> prefix = protectedPrefix(rules, candidate);
            if (prefix.isPresent()) {
                return reject(ErrorKind.BLOCKED_PATH, "Access to blocked path: " + candidate + " (protected: " + prefix.get() + ")");
            }
        }
        return Optional.empty();
    }

    public static String joinCommandLine(String program, List<String> args) {
        if (args == null || args.isEmpty()) {
            return program;
        }
        return program + " " + String.join(" ", args);
    }

    public static boolean looksLikePath(String arg) {
        if (arg == null || arg.isEmpty()) {
            return false;
        }
        return arg.startsWith("/") || arg.startsWith("./") || arg.startsWith("../") || arg.contains("/");
    }

    public static String commandName(String program) {
        int slash = program.lastIndexOf('/');
        if (slash < 0 || slash == program.length() - 1) {
            return program;
        }
        return program.substring(slash + 1);
    }

    public static boolean isUnder(String path, String prefix) {
        if ("/".equals(prefix)) {
            return "/".equals(path);
        }
        String base = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        return path.equals(base) || path.startsWith(base + "/");
    }

    // Wrapped invocations such as "sudo reboot" or "bash -c 'halt'" carry the program as an argument.
    private static Optional<String> blockedWord(GuardRules rules, String arg) {
        if (arg == null || arg.isBlank()) {
            return Optional.empty();
        }
        for (String word : WORD_SEPARATOR.split(arg.trim())) {
            if (word.isEmpty()) {
                continue;
            }
            String name = commandName(word);
            if (rules.blockedCommands().contains(word) || rules.blockedCommands().contains(name)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> protectedPrefix(GuardRules rules, String candidate) {
        String normalized = normalize(candidate);
        for (String prefix : rules.protectedPaths()) {
            if (isUnder(candidate, prefix) || isUnder(normalized, prefix)) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String candidate) {
        try {
            String normalized = Path.of(candidate).normalize().toString();
            return normalized.isEmpty() ? candidate : normalized;
        } catch (InvalidPathException ignored) {
            return candidate;
        }
    }

    private static Optional<CommandRejectedException> reject(ErrorKind kind, String reason) {
        return Optional.of(new CommandRejectedException(kind, reason));
    }
}
