package io.aegis.core.exec;

import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Running command. {@link #cancel()} kills the process tree; a thread interrupted while in
 * {@link #await()} cancels as well, so abandoning the wait never leaves the process behind.
 */
public final class ExecutionHandle {
    private final Process process;
    private final AtomicBoolean cancelled;
    private final CompletableFuture<ProcessResult> result;

    ExecutionHandle(Process process, AtomicBoolean cancelled, CompletableFuture<ProcessResult> result) {
        this.process = process;
        this.cancelled = cancelled;
        this.result = result;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            ProcessRunner.destroyTree(process);
        }
    }

    public ProcessResult await() throws CommandRejectedException {
        try {
            return result.get();
        } catch (InterruptedException e) {
            cancel();
            Thread.currentThread().interrupt();
            throw new CommandRejectedException(ErrorKind.CANCELLED, "Interrupted while waiting for command; process killed", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CommandRejectedException(ErrorKind.CANCELLED, "Command was cancelled", e);
        }
    }

    /**
     * Derives a handle over the same process whose result is post-processed by {@code step}.
     * The step runs exactly once, whether the command succeeded or failed.
     */
    public ExecutionHandle then(Completion step) {
        CompletableFuture<ProcessResult> next = result.handle((value, error) -> {
            CommandRejectedException failure = error == null ? null : unwrap(error);
            try {
                return step.complete(value, failure);
            } catch (CommandRejectedException e) {
                throw new CompletionException(e);
            }
        });
        return new ExecutionHandle(process, cancelled, next);
    }

    static CommandRejectedException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof CommandRejectedException rejected) {
            return rejected;
        }
        return new CommandRejectedException(ErrorKind.EXECUTION_FAILED, "Command execution failed: " + current.getMessage(), current);
    }

    @FunctionalInterface
    public interface Completion {
        ProcessResult complete(ProcessResult result, CommandRejectedException failure) throws CommandRejectedException;
    }
}
