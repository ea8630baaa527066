package io.aegis.core.exec;

import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns argv arrays (never a shell string) with stdin closed and both output pipes drained
 * concurrently into a bounded buffer.
 */
public final class ProcessRunner implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);
    private static final Duration READER_GRACE = Duration.ofSeconds(2);
    private static final int CHUNK = 8192;

    private final ExecutorService executor;

    public ProcessRunner() {
        this(Executors.newCachedThreadPool(daemonThreads()));
    }

    public ProcessRunner(ExecutorService executor) {
        this.executor = executor;
    }

    public ExecutionHandle start(List<String> argv, Duration timeout, long maxOutputBytes) throws CommandRejectedException {
        if (argv == null || argv.isEmpty() || argv.get(0) == null || argv.get(0).isBlank()) {
            throw new CommandRejectedException(ErrorKind.EMPTY_COMMAND, "Empty command");
        }
        Process process;
        try {
            process = new ProcessBuilder(argv).start();
        } catch (IOException e) {
            throw new CommandRejectedException(ErrorKind.EXECUTION_FAILED, "Failed to start '" + argv.get(0) + "': " + e.getMessage(), e);
        }
        closeStdin(process);

        AtomicBoolean cancelled = new AtomicBoolean(false);
        long startNanos = System.nanoTime();
        CompletableFuture<ProcessResult> result = CompletableFuture.supplyAsync(() -> {
            try {
                return supervise(process, cancelled, timeout, maxOutputBytes, startNanos);
            } catch (CommandRejectedException e) {
                throw new CompletionException(e);
            }
        }, executor);
        return new ExecutionHandle(process, cancelled, result);
    }

    public ProcessResult run(List<String> argv, Duration timeout, long maxOutputBytes) throws CommandRejectedException {
        return start(argv, timeout, maxOutputBytes).await();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private ProcessResult supervise(
        Process process,
        AtomicBoolean cancelled,
        Duration timeout,
        long maxOutputBytes,
        long startNanos
    ) throws CommandRejectedException {
        BoundedCapture capture = new BoundedCapture(maxOutputBytes, () -> destroyTree(process));
        Future<?> stdoutReader = executor.submit(() -> capture.drain(process.getInputStream(), capture.stdout));
        Future<?> stderrReader = executor.submit(() -> capture.drain(process.getErrorStream(), capture.stderr));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                awaitReader(stdoutReader);
                awaitReader(stderrReader);
                if (cancelled.get()) {
                    throw new CommandRejectedException(ErrorKind.CANCELLED, "Command was cancelled");
                }
                LOG.warn("Killed pid {} after exceeding {} ms", process.pid(), timeout.toMillis());
                throw new CommandRejectedException(ErrorKind.TIMEOUT, "Command timed out after " + describe(timeout));
            }
            awaitReader(stdoutReader);
            awaitReader(stderrReader);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new CommandRejectedException(ErrorKind.CANCELLED, "Command supervision interrupted; process killed", e);
        }

        if (cancelled.get()) {
            throw new CommandRejectedException(ErrorKind.CANCELLED, "Command was cancelled");
        }
        if (capture.overflowed()) {
            throw new CommandRejectedException(
                ErrorKind.OUTPUT_TOO_LARGE,
                "Command output too large (limit " + maxOutputBytes + " bytes)"
            );
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new ProcessResult(process.exitValue(), capture.stdoutText(), capture.stderrText(), durationMs);
    }

    private void awaitReader(Future<?> reader) throws InterruptedException {
        try {
            reader.get(READER_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // a detached grandchild can keep the pipe open
            reader.cancel(true);
            LOG.debug("Output reader did not finish within {} ms", READER_GRACE.toMillis());
        } catch (ExecutionException e) {
            LOG.debug("Output reader failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static String describe(Duration timeout) {
        if (timeout.toMillis() % 1000 == 0) {
            return timeout.toSeconds() + " seconds";
        }
        return timeout.toMillis() + " ms";
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "aegis-process-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class BoundedCapture {
        private final long limit;
        private final Runnable onOverflow;
        private final AtomicLong total = new AtomicLong();
        private final AtomicBoolean overflowed = new AtomicBoolean(false);
        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        private BoundedCapture(long limit, Runnable onOverflow) {
            this.limit = limit;
            this.onOverflow = onOverflow;
        }

        private Void drain(InputStream in, ByteArrayOutputStream sink) throws IOException {
            byte[] buffer = new byte[CHUNK];
            try (in) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    long seen = total.addAndGet(read);
                    if (seen > limit) {
                        if (overflowed.compareAndSet(false, true)) {
                            onOverflow.run();
                        }
                        continue;
                    }
                    synchronized (sink) {
                        sink.write(buffer, 0, read);
                    }
                }
            }
            return null;
        }

        private boolean overflowed() {
            return overflowed.get();
        }

        private String stdoutText() {
            synchronized (stdout) {
                return stdout.toString(StandardCharsets.UTF_8);
            }
        }

        private String stderrText() {
            synchronized (stderr) {
                return stderr.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
