package io.aegis.core.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void shouldCaptureStdoutAndExitCode() throws Exception {
        ProcessResult result = runner.run(List.of("echo", "hello"), Duration.ofSeconds(5), 1024);

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("hello\n");
        assertThat(result.stderr()).isEmpty();
    }

    @Test
    void shouldCloseStdinSoReadersSeeEndOfInput() throws Exception {
        ProcessResult result = runner.run(List.of("cat"), Duration.ofSeconds(5), 1024);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout()).isEmpty();
    }

    @Test
    void shouldKillWholeTreeOnTimeout() throws Exception {
        ExecutionHandle handle = runner.start(List.of("sh", "-c", "sleep 30 & sleep 30"), Duration.ofMillis(500), 1024);
        TimeUnit.MILLISECONDS.sleep(200);
        List<ProcessHandle> descendants = ProcessHandle.of(handle.pid())
            .map(process -> process.descendants().toList())
            .orElse(List.of());

        long started = System.nanoTime();
        assertThatThrownBy(handle::await)
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.TIMEOUT));
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));

        for (ProcessHandle descendant : descendants) {
            descendant.onExit().get(5, TimeUnit.SECONDS);
            assertThat(descendant.isAlive()).isFalse();
        }
    }

    @Test
    void shouldStopReadingAndFailWhenOutputExceedsLimit() {
        assertThatThrownBy(() -> runner.run(List.of("echo", "0123456789012345678901234567890123456789"), Duration.ofSeconds(5), 16))
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.OUTPUT_TOO_LARGE);
                assertThat(e.reason()).contains("16 bytes");
            });
    }

    @Test
    void shouldReportCancellation() throws Exception {
        ExecutionHandle handle = runner.start(List.of("sleep", "30"), Duration.ofSeconds(30), 1024);

        handle.cancel();

        assertThatThrownBy(handle::await)
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.CANCELLED));
        assertThat(handle.isCancelled()).isTrue();
    }

    @Test
    void shouldRunCompletionStepOnSuccessAndFailure() throws Exception {
        ExecutionHandle ok = runner.start(List.of("echo", "x"), Duration.ofSeconds(5), 1024)
            .then((result, failure) -> new ProcessResult(result.exitCode(), result.stdout().trim() + "!", "", result.durationMs()));
        assertThat(ok.await().stdout()).isEqualTo("x!");

        ExecutionHandle failed = runner.start(List.of("sleep", "5"), Duration.ofMillis(100), 1024)
            .then((result, failure) -> {
                assertThat(failure).isNotNull();
                throw new CommandRejectedException(ErrorKind.EXECUTION_FAILED, "wrapped " + failure.kind().label());
            });
        assertThatThrownBy(failed::await)
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.reason()).isEqualTo("wrapped timeout"));
    }

    @Test
    void shouldReportMissingExecutable() {
        assertThatThrownBy(() -> runner.run(List.of("definitely-not-a-real-binary-aegis"), Duration.ofSeconds(1), 1024))
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.EXECUTION_FAILED));
    }
}
