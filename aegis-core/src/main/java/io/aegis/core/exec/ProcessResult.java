package io.aegis.core.exec;

public record ProcessResult(
    int exitCode,
    String stdout,
    String stderr,
    long durationMs
) {
    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        durationMs = Math.max(0, durationMs);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public String combinedOutput() {
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return stdout + " " + stderr;
    }
}
