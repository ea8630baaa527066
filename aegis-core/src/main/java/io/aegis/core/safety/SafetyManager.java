package io.aegis.core.safety;

import io.aegis.core.config.model.SafetyConfig;
import io.aegis.core.exec.ExecutionHandle;
import io.aegis.core.exec.ProcessResult;
import io.aegis.core.exec.ProcessRunner;
import io.aegis.core.guard.CommandGuard;
import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import io.aegis.core.guard.GuardRules;
import io.aegis.core.guard.OutputInspector;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second enforcement layer around command execution: its own validation, start-rate
 * throttling, resource ceilings, a bounded history and a post-execution output scan.
 */
public final class SafetyManager {
    private static final Logger LOG = LoggerFactory.getLogger(SafetyManager.class);

    private final ProcessRunner runner;
    private final ResourceProbe probe;
    private final Clock clock;
    private final OutputInspector outputInspector = OutputInspector.safetyDefaults();
    private final CommandHistory history;
    private final Throttle commandThrottle;
    private final Throttle apiThrottle;
    private final long maxOutputBytes;

    private final ReentrantReadWriteLock rulesLock = new ReentrantReadWriteLock();
    private final Set<String> blockedCommands;
    private final Set<String> blockedPaths;
    private final List<Pattern> dangerousPatterns;
    private GuardRules rules;

    private final ReentrantReadWriteLock statsLock = new ReentrantReadWriteLock();
    private ResourceLimits limits;
    private long commandsExecuted;
    private long commandsBlocked;
    private long memoryUsageMb;
    private double cpuUsagePercent;
    private Instant lastUpdated;

    private final AdjustableSemaphore slots;
    private final AtomicInteger activeCommands = new AtomicInteger();

    public SafetyManager(ProcessRunner runner) {
        this(SafetyConfig.defaults(), runner, ResourceProbe.none(), Clock.systemUTC());
    }

    public SafetyManager(SafetyConfig config, ProcessRunner runner, ResourceProbe probe, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.history = new CommandHistory(config.historyCapacity());
        this.commandThrottle = new Throttle(Duration.ofMillis(config.commandIntervalMs()));
        this.apiThrottle = new Throttle(Duration.ofMillis(config.apiIntervalMs()));
        this.maxOutputBytes = config.maxOutputBytes();
        this.blockedCommands = new LinkedHashSet<>(config.blockedCommands());
        this.blockedPaths = new LinkedHashSet<>(config.blockedPaths());
        this.dangerousPatterns = new ArrayList<>(GuardRules.compile(config.dangerousPatterns()));
        this.rules = buildRules();
        this.limits = new ResourceLimits(
            config.maxMemoryMb(),
            config.maxCpuPercent(),
            config.maxExecutionTimeSecs(),
            config.maxConcurrentCommands()
        );
        this.slots = new AdjustableSemaphore(limits.maxConcurrentCommands());
        this.lastUpdated = clock.instant();
    }

    public ProcessResult executeSafeCommand(String command, List<String> args, String user) throws CommandRejectedException {
        return startSafeCommand(command, args, user).await();
    }

    /**
     * Runs every pre-execution check, then spawns. The returned handle records the outcome
     * and scans the output once the process ends; a dangerous signature turns the run into a
     * {@link ErrorKind#DANGEROUS_OUTPUT} failure.
     */
    public ExecutionHandle startSafeCommand(String command, List<String> args, String user) throws CommandRejectedException {
        List<String> arguments = args == null ? List.of() : List.copyOf(args);
        String fullCommand = CommandGuard.joinCommandLine(command == null ? "" : command, arguments);
        String who = user == null || user.isBlank() ? "unknown" : user.trim();

        try {
            checkCommand(command, arguments);
        } catch (CommandRejectedException e) {
            LOG.warn("Safety check blocked '{}' for {}: {}", fullCommand, who, e.reason());
            record(fullCommand, who, true, e.reason(), null);
            throw e;
        }

        try {
            commandThrottle.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(fullCommand, who, true, "Interrupted while rate limited", null);
            throw new CommandRejectedException(ErrorKind.RATE_LIMITED, "Interrupted while waiting for the command rate limit", e);
        }

        acquireSlot(fullCommand, who);
        activeCommands.incrementAndGet();
        long startNanos = System.nanoTime();
        List<String> argv = new ArrayList<>(arguments.size() + 1);
        argv.add(command);
        argv.addAll(arguments);

        ExecutionHandle handle;
        try {
            handle = runner.start(argv, Duration.ofSeconds(resourceLimits().maxExecutionTimeSecs()), maxOutputBytes);
        } catch (CommandRejectedException e) {
            finish();
            record(fullCommand, who, true, e.reason(), elapsedMs(startNanos));
            throw e;
        }

        return handle.then((result, failure) -> {
            finish();
            if (failure != null) {
                record(fullCommand, who, true, failure.reason(), elapsedMs(startNanos));
                throw failure;
            }
            Optional<OutputInspector.Signature> signature = outputInspector.inspect(result.combinedOutput());
            if (signature.isPresent()) {
                LOG.warn("Dangerous output from '{}' for {}: {}", fullCommand, who, signature.get().describe());
                record(fullCommand, who, true, "Dangerous output detected", result.durationMs());
                throw new CommandRejectedException(
                    ErrorKind.DANGEROUS_OUTPUT,
                    "Command execution blocked: dangerous output detected (" + signature.get().describe() + ")"
                );
            }
            record(fullCommand, who, false, null, result.durationMs());
            return result;
        });
    }

    /**
     * Dry run of the validation step; nothing is recorded or spawned.
     */
    public void checkCommand(String command, List<String> args) throws CommandRejectedException {
        CommandGuard.check(currentRules(), command, args);
    }

    public void enforceApiRateLimit() throws CommandRejectedException {
        try {
            apiThrottle.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandRejectedException(ErrorKind.RATE_LIMITED, "Interrupted while waiting for the API rate limit", e);
        }
    }

    public Map<String, String> getStats() {
        SystemStats stats = systemStats();
        Map<String, String> result = new LinkedHashMap<>();
        result.put("total_commands_executed", Long.toString(stats.totalCommandsExecuted()));
        result.put("total_commands_blocked", Long.toString(stats.totalCommandsBlocked()));
        result.put("active_commands", Integer.toString(stats.activeCommands()));
        result.put("memory_usage_mb", Long.toString(stats.memoryUsageMb()));
        result.put("cpu_usage_percent", String.format(Locale.ROOT, "%.1f", stats.cpuUsagePercent()));
        result.put("history_size", Integer.toString(history.size()));
        rulesLock.readLock().lock();
        try {
            result.put("blocked_commands_count", Integer.toString(blockedCommands.size()));
            result.put("blocked_paths_count", Integer.toString(blockedPaths.size()));
        } finally {
            rulesLock.readLock().unlock();
        }
        return result;
    }

    public SystemStats systemStats() {
        statsLock.readLock().lock();
        try {
            return new SystemStats(
                commandsExecuted,
                commandsBlocked,
                activeCommands.get(),
                memoryUsageMb,
                cpuUsagePercent,
                lastUpdated
            );
        } finally {
            statsLock.readLock().unlock();
        }
    }

    /**
     * Newest first.
     */
    public List<CommandRecord> getCommandHistory(int limit) {
        return history.recent(limit);
    }

    public String exportAuditLog() {
        StringBuilder log = new StringBuilder("Safety Audit Log\n================\n\n");
        for (CommandRecord record : history.snapshot()) {
            log.append('[').append(record.timestamp()).append("] User: ").append(record.user())
                .append(" | Command: ").append(record.command())
                .append(" | Blocked: ").append(record.blocked())
                .append(" | Time: ").append(record.executionTimeMs() == null ? "-" : record.executionTimeMs() + "ms")
                .append('\n');
            if (record.reason() != null) {
                log.append("  Reason: ").append(record.reason()).append('\n');
            }
            log.append('\n');
        }
        return log.toString();
    }

    public void addBlockedCommand(String command) {
        mutateRules(() -> blockedCommands.add(requireText(command, "command")));
        LOG.info("Safety blocked command '{}'", command);
    }

    public void removeBlockedCommand(String command) {
        mutateRules(() -> blockedCommands.remove(command));
        LOG.info("Safety unblocked command '{}'", command);
    }

    public void addBlockedPath(String path) {
        mutateRules(() -> blockedPaths.add(requireText(path, "path")));
        LOG.info("Safety blocked path '{}'", path);
    }

    public ResourceLimits resourceLimits() {
        statsLock.readLock().lock();
        try {
            return limits;
        } finally {
            statsLock.readLock().unlock();
        }
    }

    /**
     * Commands already running keep the permit they hold. Lowering the concurrency ceiling
     * below the number of running commands refuses new starts until enough of them finish.
     */
    public void updateResourceLimits(ResourceLimits newLimits) {
        Objects.requireNonNull(newLimits, "newLimits must not be null");
        statsLock.writeLock().lock();
        try {
            slots.resize(newLimits.maxConcurrentCommands() - limits.maxConcurrentCommands());
            limits = newLimits;
        } finally {
            statsLock.writeLock().unlock();
        }
        LOG.info("Safety resource limits updated: {}", newLimits);
    }

    public int clearHistory(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        int removed = history.removeOlderThan(clock.instant().minus(olderThan));
        LOG.info("Cleared {} command records older than {}", removed, olderThan);
        return removed;
    }

    private void acquireSlot(String fullCommand, String user) throws CommandRejectedException {
        if (!slots.tryAcquire()) {
            throw resourceExceeded(fullCommand, user, "Too many concurrent commands");
        }
        ResourceProbe.Sample sample = refreshUsage();
        ResourceLimits current = resourceLimits();
        if (sample.memoryUsageMb() >= current.maxMemoryMb()) {
            slots.release();
            throw resourceExceeded(fullCommand, user, "Memory limit exceeded");
        }
        if (sample.cpuUsagePercent() >= current.maxCpuPercent()) {
            slots.release();
            throw resourceExceeded(fullCommand, user, "CPU limit exceeded");
        }
    }

    private CommandRejectedException resourceExceeded(String fullCommand, String user, String reason) {
        LOG.warn("Refused '{}' for {}: {}", fullCommand, user, reason);
        record(fullCommand, user, true, reason, null);
        return new CommandRejectedException(ErrorKind.RESOURCE_EXCEEDED, reason);
    }

    private void finish() {
        slots.release();
        activeCommands.decrementAndGet();
        refreshUsage();
    }

    private ResourceProbe.Sample refreshUsage() {
        ResourceProbe.Sample sample = probe.sample();
        statsLock.writeLock().lock();
        try {
            memoryUsageMb = sample.memoryUsageMb();
            cpuUsagePercent = sample.cpuUsagePercent();
            lastUpdated = clock.instant();
        } finally {
            statsLock.writeLock().unlock();
        }
        return sample;
    }

    private void record(String command, String user, boolean blocked, String reason, Long executionTimeMs) {
        history.append(new CommandRecord(command, clock.instant(), user, blocked, reason, executionTimeMs));
        statsLock.writeLock().lock();
        try {
            if (blocked) {
                commandsBlocked++;
            } else {
                commandsExecuted++;
            }
        } finally {
            statsLock.writeLock().unlock();
        }
    }

    private GuardRules currentRules() {
        rulesLock.readLock().lock();
        try {
            return rules;
        } finally {
            rulesLock.readLock().unlock();
        }
    }

    private void mutateRules(Runnable change) {
        rulesLock.writeLock().lock();
        try {
            change.run();
            rules = buildRules();
        } finally {
            rulesLock.writeLock().unlock();
        }
    }

    // "~/" entries are protected both literally and expanded against the user's home
    private GuardRules buildRules() {
        Set<String> protectedPaths = new LinkedHashSet<>();
        String home = System.getProperty("user.home", "");
        for (String path : blockedPaths) {
            protectedPaths.add(path);
            if (path.startsWith("~/") && !home.isEmpty()) {
                protectedPaths.add(home + path.substring(1));
            }
        }
        return new GuardRules(Set.of(), blockedCommands, protectedPaths, dangerousPatterns);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.trim();
    }

    // Permits may go negative after a reduction; releases then pay the debt first.
    private static final class AdjustableSemaphore extends Semaphore {
        private static final long serialVersionUID = 1L;

        AdjustableSemaphore(int permits) {
            super(permits);
        }

        void resize(int delta) {
            if (delta > 0) {
                release(delta);
            } else if (delta < 0) {
                reducePermits(-delta);
            }
        }
    }
}
