package io.aegis.core.sandbox;

import io.aegis.core.config.model.SandboxConfig;
import io.aegis.core.exec.ExecutionHandle;
import io.aegis.core.exec.ProcessResult;
import io.aegis.core.exec.ProcessRunner;
import io.aegis.core.guard.CommandGuard;
import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import io.aegis.core.guard.GuardRules;
import io.aegis.core.guard.OutputInspector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates commands against its own rule set and runs them under a wall-clock timeout and
 * an output cap. Every execution path re-validates, so a caller cannot skip the checks.
 */
public final class Sandbox {
    private static final Logger LOG = LoggerFactory.getLogger(Sandbox.class);
    static final List<String> SYSTEM_PATHS = List.of("/etc", "/sys", "/dev", "/proc", "/boot");

    private final ProcessRunner runner;
    private final OutputInspector outputInspector;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Set<String> allowedCommands;
    private final Set<String> blockedCommands;
    private final Set<String> allowedPaths;
    private final Set<String> blockedPaths;
    private final List<Pattern> dangerousPatterns;
    private Duration maxExecutionTime;
    private long maxOutputBytes;
    private GuardRules rules;

    public Sandbox(ProcessRunner runner) {
        this(SandboxConfig.defaults(), runner);
    }

    public Sandbox(SandboxConfig config, ProcessRunner runner) {
        Objects.requireNonNull(config, "config must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.outputInspector = OutputInspector.sandboxDefaults();
        this.allowedCommands = new LinkedHashSet<>(config.allowedCommands());
        this.blockedCommands = new LinkedHashSet<>(config.blockedCommands());
        this.allowedPaths = new LinkedHashSet<>(config.allowedPaths());
        this.blockedPaths = new LinkedHashSet<>(config.blockedPaths());
        this.dangerousPatterns = new ArrayList<>(GuardRules.compile(config.dangerousPatterns()));
        this.maxExecutionTime = Duration.ofSeconds(config.maxExecutionTimeSecs());
        this.maxOutputBytes = config.maxOutputBytes();
        this.rules = buildRules();
    }

    public void validateCommand(String program, List<String> args) throws CommandRejectedException {
        try {
            CommandGuard.check(currentRules(), program, args);
        } catch (CommandRejectedException e) {
            LOG.warn("Sandbox rejected '{}': {}", CommandGuard.joinCommandLine(program, args), e.reason());
            throw e;
        }
    }

    /**
     * Dry run of {@link #validateCommand}; nothing is spawned.
     */
    public Optional<CommandRejectedException> testCommand(String program, List<String> args) {
        return CommandGuard.findViolation(currentRules(), program, args);
    }

    public ExecutionHandle start(String program, List<String> args) throws CommandRejectedException {
        validateCommand(program, args);
        Duration timeout;
        long outputLimit;
        lock.readLock().lock();
        try {
            timeout = maxExecutionTime;
            outputLimit = maxOutputBytes;
        } finally {
            lock.readLock().unlock();
        }

        List<String> argv = new ArrayList<>();
        argv.add(program);
        if (args != null) {
            argv.addAll(args);
        }
        LOG.debug("Sandbox executing {}", argv);
        String commandLine = CommandGuard.joinCommandLine(program, args);
        return runner.start(argv, timeout, outputLimit).then((result, failure) -> {
            if (failure != null) {
                throw failure;
            }
            return inspect(commandLine, result);
        });
    }

    public ProcessResult executeSafe(String program, List<String> args) throws CommandRejectedException {
        return start(program, args).await();
    }

    public ProcessResult executeCommandString(String raw) throws CommandRejectedException {
        ParsedCommand parsed = parseCommandString(raw);
        return executeSafe(parsed.program(), parsed.args());
    }

    public ParsedCommand parseCommandString(String raw) throws CommandRejectedException {
        return CommandLineParser.parse(raw);
    }

    public void allowCommand(String command) {
        mutate(() -> allowedCommands.add(requireText(command, "command")));
        LOG.info("Sandbox allowed command '{}'", command);
    }

    public void blockCommand(String command) {
        mutate(() -> {
            String value = requireText(command, "command");
            blockedCommands.add(value);
            allowedCommands.remove(value);
        });
        LOG.info("Sandbox blocked command '{}'", command);
    }

    public void allowPath(String path) {
        mutate(() -> allowedPaths.add(requireText(path, "path")));
        LOG.info("Sandbox allowed path '{}'", path);
    }

    public void blockPath(String path) {
        mutate(() -> blockedPaths.add(requireText(path, "path")));
        LOG.info("Sandbox blocked path '{}'", path);
    }

    public void configure(Duration maxExecutionTime, long maxOutputBytes) {
        Objects.requireNonNull(maxExecutionTime, "maxExecutionTime must not be null");
        if (maxExecutionTime.isZero() || maxExecutionTime.isNegative()) {
            throw new IllegalArgumentException("maxExecutionTime must be positive");
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive");
        }
        mutate(() -> {
            this.maxExecutionTime = maxExecutionTime;
            this.maxOutputBytes = maxOutputBytes;
        });
        LOG.info("Sandbox limits set to {} ms and {} bytes", maxExecutionTime.toMillis(), maxOutputBytes);
    }

    public Set<String> allowedCommands() {
        lock.readLock().lock();
        try {
            return Set.copyOf(allowedCommands);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> blockedCommands() {
        lock.readLock().lock();
        try {
            return Set.copyOf(blockedCommands);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> dangerousPatterns() {
        lock.readLock().lock();
        try {
            return dangerousPatterns.stream().map(Pattern::pattern).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> stats() {
        lock.readLock().lock();
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("allowed_commands", allowedCommands.size());
            stats.put("blocked_commands", blockedCommands.size());
            stats.put("allowed_paths", allowedPaths.size());
            stats.put("blocked_paths", blockedPaths.size());
            stats.put("dangerous_patterns", dangerousPatterns.size());
            stats.put("max_execution_time_secs", maxExecutionTime.toSeconds());
            stats.put("max_output_size", maxOutputBytes);
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    private ProcessResult inspect(String commandLine, ProcessResult result) throws CommandRejectedException {
        Optional<OutputInspector.Signature> signature = outputInspector.inspect(result.combinedOutput());
        if (signature.isPresent()) {
            LOG.warn("Dangerous output from '{}': {}", commandLine, signature.get().describe());
            throw new CommandRejectedException(
                ErrorKind.DANGEROUS_OUTPUT,
                "Command output contains dangerous pattern: " + signature.get().describe()
            );
        }
        if (!result.succeeded()) {
            String stderr = result.stderr().isBlank() ? "" : ": " + result.stderr().trim();
            throw new CommandRejectedException(
                ErrorKind.EXECUTION_FAILED,
                "Command failed with exit code " + result.exitCode() + stderr
            );
        }
        return result;
    }

    private GuardRules currentRules() {
        lock.readLock().lock();
        try {
            return rules;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void mutate(Runnable change) {
        lock.writeLock().lock();
        try {
            change.run();
            rules = buildRules();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock, or is the constructor
    private GuardRules buildRules() {
        Set<String> protectedPaths = new LinkedHashSet<>(blockedPaths);
        protectedPaths.addAll(SYSTEM_PATHS);
        return new GuardRules(allowedCommands, blockedCommands, protectedPaths, dangerousPatterns);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.trim();
    }
}
